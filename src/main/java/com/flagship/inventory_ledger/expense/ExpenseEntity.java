package com.flagship.inventory_ledger.expense;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "expenses")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
class ExpenseEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 20)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "account_id", nullable = false, updatable = false, length = 20)
    private String accountId;

    @Column(name = "counterparty_id", nullable = false, updatable = false, length = 20)
    private String counterpartyId;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(length = 1000)
    private String description;

    @Column(name = "expense_date", nullable = false)
    private LocalDate expenseDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static ExpenseEntity create(String id, String name, BigDecimal amount, String accountId, String counterpartyId,
                                String category, String description, LocalDate expenseDate) {
        return new ExpenseEntity(id, name, amount, accountId, counterpartyId, category, description,
                expenseDate, null);
    }

    Expense toDomain() {
        return new Expense(id, name, amount, accountId, counterpartyId, category, description,
                expenseDate, createdAt);
    }
}
