package com.flagship.inventory_ledger.production.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class CreateBatchRequest {

    @NotBlank(message = "Final product ID is required")
    @JsonProperty("final_product_id")
    String finalProductId;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be greater than 0")
    @JsonProperty("quantity")
    Integer quantity;

    @NotEmpty(message = "Serial numbers are required")
    @JsonProperty("serial_numbers")
    List<String> serialNumbers;
}
