package com.flagship.inventory_ledger.party.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.party.AccountType;
import com.flagship.inventory_ledger.party.PaymentAccount;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    AccountType accountType;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(PaymentAccount account) {
        return AccountResponse.builder()
            .id(account.getId())
            .name(account.getName())
            .accountType(account.getAccountType())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
