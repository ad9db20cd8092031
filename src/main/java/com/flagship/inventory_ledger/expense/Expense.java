package com.flagship.inventory_ledger.expense;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Value
public class Expense {
    String id;
    String name;
    BigDecimal amount;
    String accountId;
    String counterpartyId;
    String category;
    String description;
    LocalDate expenseDate;
    Instant createdAt;
}
