package com.datachain.semantic;

import com.datachain.types.Aggregation;

import java.util.Objects;

/**
 * Direct aggregation of a column, e.g. {@code SUM(orders.revenue)}.
 */
public record KpiMetric(String table, String column, Aggregation aggregation) implements KpiExpression {

    public KpiMetric {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(aggregation, "aggregation must not be null");
    }
}
