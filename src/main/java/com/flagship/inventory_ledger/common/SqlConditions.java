package com.flagship.inventory_ledger.common;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * WHERE-clause fragments shared by the JDBC ledger queries.
 */
public final class SqlConditions {

    private SqlConditions() {
    }

    /**
     * Adds an inclusive calendar-day range on {@code created_at}, in UTC.
     */
    public static void appendDateRange(StringBuilder where, List<Object> params, LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from_date must not be after to_date");
        }
        if (from != null) {
            where.append(" AND created_at >= ?");
            params.add(from.atStartOfDay().atOffset(ZoneOffset.UTC));
        }
        if (to != null) {
            where.append(" AND created_at < ?");
            params.add(to.plusDays(1).atStartOfDay().atOffset(ZoneOffset.UTC));
        }
    }

    /**
     * Adds a case-insensitive substring match over the given columns.
     */
    public static void appendSearch(StringBuilder where, List<Object> params, String search, String... columns) {
        if (search == null || search.isBlank()) {
            return;
        }
        String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        where.append(" AND (");
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                where.append(" OR ");
            }
            where.append("LOWER(").append(columns[i]).append(") LIKE ?");
            params.add(pattern);
        }
        where.append(")");
    }
}
