package com.flagship.inventory_ledger.production.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class UpdateBatchRequest {

    @Min(value = 1, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    Integer quantity;

    @Size(min = 1, message = "Serial numbers, when given, cannot be empty")
    @JsonProperty("serial_numbers")
    List<String> serialNumbers;

    @Size(min = 1, message = "Recipe items, when given, cannot be empty")
    @Valid
    @JsonProperty("recipe_items")
    List<RecipeLineRequest> recipeItems;
}
