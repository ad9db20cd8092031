package com.flagship.inventory_ledger.production.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class UpdateRecipeRequest {

    @Size(max = 200, message = "Name must be at most 200 characters")
    @JsonProperty("name")
    String name;

    @Size(min = 1, message = "Recipe items, when given, cannot be empty")
    @Valid
    @JsonProperty("items")
    List<RecipeLineRequest> items;
}
