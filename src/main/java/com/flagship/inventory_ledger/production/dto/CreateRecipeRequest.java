package com.flagship.inventory_ledger.production.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class CreateRecipeRequest {

    @NotBlank(message = "Final product ID is required")
    @JsonProperty("final_product_id")
    String finalProductId;

    @Size(max = 200, message = "Name must be at most 200 characters")
    @JsonProperty("name")
    String name;

    @NotEmpty(message = "At least one recipe item is required")
    @Valid
    @JsonProperty("items")
    List<RecipeLineRequest> items;
}
