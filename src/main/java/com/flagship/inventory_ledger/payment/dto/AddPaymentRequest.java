package com.flagship.inventory_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class AddPaymentRequest {

    @NotBlank(message = "Invoice ID is required")
    @JsonProperty("invoice_id")
    String invoiceId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be at least 0.01")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Account ID is required")
    @JsonProperty("account_id")
    String accountId;
}
