package com.datachain.query;

import com.datachain.types.Sorting;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * ORDER BY request: a {@code table.column} dimension, or a measure or KPI name.
 */
public record OrderBy(String field, Sorting sorting) {

    public OrderBy {
        Objects.requireNonNull(field, "order by field must not be null");
        sorting = sorting == null ? Sorting.ASC : sorting;
    }

    public static OrderBy asc(String field) {
        return new OrderBy(field, Sorting.ASC);
    }

    public static OrderBy desc(String field) {
        return new OrderBy(field, Sorting.DESC);
    }

    @JsonIgnore
    public boolean isDimensionRef() {
        return field.contains(".");
    }
}
