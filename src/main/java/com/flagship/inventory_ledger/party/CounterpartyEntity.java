package com.flagship.inventory_ledger.party;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "counterparties")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CounterpartyEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 20)
    private String id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private CounterpartyRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static CounterpartyEntity create(String id, String name, CounterpartyRole role) {
        return new CounterpartyEntity(id, name, role, null);
    }

    public Counterparty toDomain() {
        return new Counterparty(id, name, role, createdAt);
    }
}
