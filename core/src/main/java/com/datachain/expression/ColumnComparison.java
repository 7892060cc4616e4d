package com.datachain.expression;

import com.datachain.types.Comparator;

import java.util.Objects;

/**
 * Comparison between two expressions, e.g. a join key pair.
 */
public record ColumnComparison(Expression left, Comparator comparator, Expression right) implements Predicate {

    public ColumnComparison {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }
}
