package com.flagship.inventory_ledger.expense;

import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Filters for expense listings. Date bounds are inclusive.
 */
final class ExpenseSpecifications {

    private ExpenseSpecifications() {
    }

    static Specification<ExpenseEntity> filter(String counterpartyId, String category,
                                               LocalDate fromDate, LocalDate toDate, String search) {
        if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("from_date must not be after to_date");
        }
        Specification<ExpenseEntity> spec = Specification.<ExpenseEntity>where(null);
        if (counterpartyId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("counterpartyId"), counterpartyId));
        }
        if (category != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("category"), category));
        }
        if (fromDate != null) {
            spec = spec.and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("expenseDate"), fromDate));
        }
        if (toDate != null) {
            spec = spec.and((root, query, cb) -> cb.lessThanOrEqualTo(root.get("expenseDate"), toDate));
        }
        if (search != null && !search.isBlank()) {
            String term = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
            spec = spec.and((root, query, cb) -> cb.or(
                    cb.like(cb.lower(root.get("name")), term),
                    cb.like(cb.lower(root.get("description")), term),
                    cb.like(cb.lower(root.get("category")), term)));
        }
        return spec;
    }
}
