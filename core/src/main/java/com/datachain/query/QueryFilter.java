package com.datachain.query;

import com.datachain.types.Comparator;

import java.util.Objects;

/**
 * Inline filter of a query.
 *
 * <p>{@code field} is {@code table.column} for dimension filters, and a
 * measure or KPI name for measure and KPI filters.
 */
public record QueryFilter(String field, Comparator comparator, Object value) {

    public QueryFilter {
        Objects.requireNonNull(field, "filter field must not be null");
        Objects.requireNonNull(comparator, "filter comparator must not be null");
    }

    public static QueryFilter of(String field, Comparator comparator, Object value) {
        return new QueryFilter(field, comparator, value);
    }

    /**
     * Returns true if the field has the {@code table.column} shape.
     */
    public boolean hasQualifiedField() {
        int dot = field.indexOf('.');
        return dot > 0 && dot == field.lastIndexOf('.') && dot < field.length() - 1;
    }

    public String table() {
        return field.substring(0, field.indexOf('.'));
    }

    public String column() {
        return field.substring(field.indexOf('.') + 1);
    }
}
