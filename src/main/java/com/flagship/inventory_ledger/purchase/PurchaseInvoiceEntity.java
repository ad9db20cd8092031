package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.common.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for purchase invoices and their lines.
 *
 * Amounts only change through {@link #applyPayment}, {@link #revertPayment}
 * and {@link #retotal}, each of which re-derives the balance and status so
 * {@code paid + balance == total} holds after every call.
 */
@Entity
@Table(name = "purchase_invoices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseInvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false, length = 20)
    private String id;

    @Column(name = "supplier_id", nullable = false, updatable = false, length = 20)
    private String supplierId;

    @Column(name = "total_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "paid_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal paidAmount;

    @Column(name = "balance_due", nullable = false, precision = 15, scale = 2)
    private BigDecimal balanceDue;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 10)
    private InvoiceStatus paymentStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<PurchaseItemEntity> items = new ArrayList<>();

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static PurchaseInvoiceEntity create(String id, String supplierId) {
        return new PurchaseInvoiceEntity(id, supplierId, Money.ZERO, Money.ZERO, Money.ZERO,
                InvoiceStatus.UNPAID, null, null, new ArrayList<>());
    }

    public PurchaseInvoice toDomain() {
        return new PurchaseInvoice(id, supplierId, totalAmount, paidAmount, balanceDue, paymentStatus,
                lines(), createdAt, updatedAt);
    }

    List<PurchaseLine> lines() {
        return items.stream().map(PurchaseItemEntity::toLine).toList();
    }

    void addLine(PurchaseLine line) {
        items.add(PurchaseItemEntity.create(this, line));
    }

    void clearLines() {
        items.clear();
    }

    /**
     * Sets the total to the sum of the current lines.
     *
     * @throws IllegalArgumentException if the new total is below what was already paid
     */
    void retotal() {
        BigDecimal total = items.stream()
                .map(PurchaseItemEntity::getLineTotal)
                .reduce(Money.ZERO, BigDecimal::add);
        if (total.compareTo(paidAmount) < 0) {
            throw new IllegalArgumentException(String.format(
                    "Invoice total %s cannot be below the amount already paid %s", total, paidAmount));
        }
        this.totalAmount = total;
        rederive();
    }

    /**
     * @throws IllegalArgumentException if the amount is not positive or exceeds the balance due
     */
    public void applyPayment(BigDecimal amount) {
        BigDecimal value = Money.requirePositive(amount, "Payment amount");
        if (value.compareTo(balanceDue) > 0) {
            throw new IllegalArgumentException(String.format(
                    "Payment %s exceeds balance due %s on invoice %s", value, balanceDue, id));
        }
        this.paidAmount = paidAmount.add(value);
        rederive();
    }

    public void revertPayment(BigDecimal amount) {
        BigDecimal value = Money.requirePositive(amount, "Payment amount");
        if (value.compareTo(paidAmount) > 0) {
            throw new IllegalStateException(String.format(
                    "Cannot revert %s on invoice %s, only %s was paid", value, id, paidAmount));
        }
        this.paidAmount = paidAmount.subtract(value);
        rederive();
    }

    private void rederive() {
        this.balanceDue = totalAmount.subtract(paidAmount);
        this.paymentStatus = InvoiceStatus.of(totalAmount, paidAmount);
    }
}
