package com.flagship.inventory_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.purchase.PurchaseLine;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class PurchaseLineRequest {

    @NotBlank(message = "Item ID is required")
    @JsonProperty("item_id")
    String itemId;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    Integer quantity;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.01", message = "Unit price must be at least 0.01")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    public PurchaseLine toLine() {
        return PurchaseLine.of(itemId, quantity, unitPrice);
    }
}
