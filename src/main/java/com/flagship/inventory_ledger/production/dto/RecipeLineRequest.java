package com.flagship.inventory_ledger.production.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.production.RecipeLine;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
@Jacksonized
public class RecipeLineRequest {

    @NotBlank(message = "Raw item ID is required")
    @JsonProperty("raw_item_id")
    String rawItemId;

    @NotNull(message = "Quantity per unit is required")
    @DecimalMin(value = "0.0001", message = "Quantity per unit must be greater than 0")
    @JsonProperty("quantity_per_unit")
    BigDecimal quantityPerUnit;

    public RecipeLine toLine() {
        return RecipeLine.of(rawItemId, quantityPerUnit);
    }

    public static List<RecipeLine> toLines(List<RecipeLineRequest> requests) {
        return requests == null ? null : requests.stream().map(RecipeLineRequest::toLine).toList();
    }
}
