package com.flagship.inventory_ledger.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for payments. Payments are immutable once written; undoing one
 * deletes the row.
 *
 * The idempotency key and the allocation method of a direct payment are
 * persistence concerns and are not part of the {@link Payment} domain object.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 20)
    private String id;

    @Column(name = "counterparty_id", nullable = false, updatable = false, length = 20)
    private String counterpartyId;

    @Column(name = "invoice_id", nullable = false, updatable = false, length = 20)
    private String invoiceId;

    @Column(nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "account_id", nullable = false, updatable = false, length = 20)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, updatable = false, length = 10)
    private PaymentType paymentType;

    @Column(name = "direct_payment_ref", updatable = false, length = 20)
    private String directPaymentRef;

    @Column(name = "idempotency_key", updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "allocation_method", updatable = false, length = 15)
    private AllocationMethod allocationMethod;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static PaymentEntity create(String id, String counterpartyId, String invoiceId, BigDecimal amount,
                                String accountId, PaymentType paymentType, String directPaymentRef,
                                String idempotencyKey, AllocationMethod allocationMethod) {
        return new PaymentEntity(id, counterpartyId, invoiceId, amount, accountId, paymentType,
                directPaymentRef, idempotencyKey, allocationMethod, null);
    }

    public Payment toDomain() {
        return new Payment(id, counterpartyId, invoiceId, amount, accountId, paymentType, directPaymentRef, createdAt);
    }
}
