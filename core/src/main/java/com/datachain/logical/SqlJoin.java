package com.datachain.logical;

import com.datachain.expression.Predicate;

import java.util.Objects;

/**
 * Join of {@code table} into the query, e.g.
 * {@code LEFT JOIN customers ON customers.id = orders.customer_id}.
 */
public record SqlJoin(JoinType type, String table, Predicate condition) {

    public SqlJoin {
        Objects.requireNonNull(type, "join type must not be null");
        Objects.requireNonNull(table, "join table must not be null");
        Objects.requireNonNull(condition, "join condition must not be null");
    }
}
