package com.flagship.inventory_ledger.purchase;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "purchase_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseItemEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "invoice_id", nullable = false, updatable = false)
    private PurchaseInvoiceEntity invoice;

    @Column(name = "item_id", nullable = false, updatable = false, length = 20)
    private String itemId;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "line_total", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal lineTotal;

    static PurchaseItemEntity create(PurchaseInvoiceEntity invoice, PurchaseLine line) {
        return new PurchaseItemEntity(null, invoice, line.getItemId(), line.getQuantity(),
                line.getUnitPrice(), line.lineTotal());
    }

    PurchaseLine toLine() {
        return PurchaseLine.of(itemId, quantity, unitPrice);
    }
}
