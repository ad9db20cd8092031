package com.flagship.inventory_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.ledger.LedgerBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("counterparty_id")
    String counterpartyId;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("balance")
    BigDecimal balance;

    public static BalanceResponse from(LedgerBalance balance) {
        return BalanceResponse.builder()
            .counterpartyId(balance.getCounterpartyId())
            .totalDebit(balance.getTotalDebit())
            .totalCredit(balance.getTotalCredit())
            .balance(balance.getBalance())
            .build();
    }
}
