package com.flagship.inventory_ledger.common;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Offset/limit paging on top of Spring Data's page-number model.
 * JPA listings round the offset down to a multiple of the limit; the
 * JDBC ledger queries apply it exactly.
 */
public final class PageRequests {

    public static final int MAX_LIMIT = 500;

    private PageRequests() {
    }

    public static Pageable of(int offset, int limit, Sort sort) {
        validate(offset, limit);
        return PageRequest.of(offset / limit, limit, sort);
    }

    public static void validate(int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
    }

    public static <T> PagedResult<T> toResult(Page<T> page, int offset, int limit) {
        return new PagedResult<>(page.getContent(), page.getTotalElements(), offset, limit);
    }
}
