package com.flagship.inventory_ledger.party.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.party.Counterparty;
import com.flagship.inventory_ledger.party.CounterpartyRole;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CounterpartyResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("role")
    CounterpartyRole role;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CounterpartyResponse from(Counterparty counterparty) {
        return CounterpartyResponse.builder()
            .id(counterparty.getId())
            .name(counterparty.getName())
            .role(counterparty.getRole())
            .createdAt(counterparty.getCreatedAt())
            .build();
    }
}
