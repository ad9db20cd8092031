package com.flagship.inventory_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
@Jacksonized
public class CreatePurchaseRequest {

    @NotBlank(message = "Supplier ID is required")
    @JsonProperty("supplier_id")
    String supplierId;

    @NotEmpty(message = "At least one purchase line is required")
    @Valid
    @JsonProperty("items")
    List<PurchaseLineRequest> items;

    @DecimalMin(value = "0.00", message = "Payment amount cannot be negative")
    @JsonProperty("payment_amount")
    BigDecimal paymentAmount;

    @JsonProperty("payment_account_id")
    String paymentAccountId;
}
