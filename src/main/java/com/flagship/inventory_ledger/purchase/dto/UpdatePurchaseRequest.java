package com.flagship.inventory_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class UpdatePurchaseRequest {

    @Valid
    @JsonProperty("items")
    List<PurchaseLineRequest> items;
}
