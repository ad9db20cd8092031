package com.flagship.inventory_ledger.common;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a filtered listing plus the total number of matching rows.
 */
@Value
public class PagedResult<T> {

    @JsonProperty("items")
    List<T> items;

    @JsonProperty("total")
    long total;

    @JsonProperty("offset")
    int offset;

    @JsonProperty("limit")
    int limit;

    public <R> PagedResult<R> map(Function<T, R> mapper) {
        return new PagedResult<>(items.stream().map(mapper).toList(), total, offset, limit);
    }
}
