package com.datachain.expression;

import com.datachain.types.Aggregation;

import java.util.Objects;

/**
 * Aggregation function applied to a column, e.g. {@code SUM(orders.revenue)}.
 */
public record AggregateMeasure(String table, String column, Aggregation aggregation) implements Expression {

    public AggregateMeasure {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(aggregation, "aggregation must not be null");
    }
}
