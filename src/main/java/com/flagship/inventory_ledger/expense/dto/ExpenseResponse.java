package com.flagship.inventory_ledger.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.expense.Expense;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class ExpenseResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("counterparty_id")
    String counterpartyId;

    @JsonProperty("category")
    String category;

    @JsonProperty("description")
    String description;

    @JsonProperty("expense_date")
    LocalDate expenseDate;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ExpenseResponse from(Expense expense) {
        return ExpenseResponse.builder()
            .id(expense.getId())
            .name(expense.getName())
            .amount(expense.getAmount())
            .accountId(expense.getAccountId())
            .counterpartyId(expense.getCounterpartyId())
            .category(expense.getCategory())
            .description(expense.getDescription())
            .expenseDate(expense.getExpenseDate())
            .createdAt(expense.getCreatedAt())
            .build();
    }
}
