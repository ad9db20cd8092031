package com.flagship.inventory_ledger.party;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "payment_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentAccountEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 20)
    private String id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 20)
    private AccountType accountType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static PaymentAccountEntity create(String id, String name, AccountType accountType) {
        return new PaymentAccountEntity(id, name, accountType, null);
    }

    public PaymentAccount toDomain() {
        return new PaymentAccount(id, name, accountType, createdAt);
    }
}
