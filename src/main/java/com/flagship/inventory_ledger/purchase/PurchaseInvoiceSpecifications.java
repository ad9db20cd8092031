package com.flagship.inventory_ledger.purchase;

import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Filters for invoice listings. Date bounds are inclusive calendar days in UTC.
 */
final class PurchaseInvoiceSpecifications {

    private PurchaseInvoiceSpecifications() {
    }

    static Specification<PurchaseInvoiceEntity> filter(String supplierId, InvoiceStatus status,
                                                       LocalDate fromDate, LocalDate toDate) {
        if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("from_date must not be after to_date");
        }
        Specification<PurchaseInvoiceEntity> spec = Specification.<PurchaseInvoiceEntity>where(null);
        if (supplierId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("supplierId"), supplierId));
        }
        if (status != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("paymentStatus"), status));
        }
        if (fromDate != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(
                    root.get("createdAt"), fromDate.atStartOfDay().toInstant(ZoneOffset.UTC)));
        }
        if (toDate != null) {
            spec = spec.and((root, query, cb) -> cb.lessThan(
                    root.get("createdAt"), toDate.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC)));
        }
        return spec;
    }
}
