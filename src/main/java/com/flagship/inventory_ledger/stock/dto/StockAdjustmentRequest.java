package com.flagship.inventory_ledger.stock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class StockAdjustmentRequest {

    @NotBlank(message = "Item ID is required")
    @JsonProperty("item_id")
    String itemId;

    @NotNull(message = "Quantity delta is required")
    @JsonProperty("quantity_delta")
    Integer quantityDelta;

    @DecimalMin(value = "0.00", message = "Unit price cannot be negative")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @Size(max = 255, message = "Reason must be at most 255 characters")
    @JsonProperty("reason")
    String reason;
}
