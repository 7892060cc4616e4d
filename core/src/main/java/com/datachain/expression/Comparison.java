package com.datachain.expression;

import com.datachain.types.Comparator;

import java.util.Objects;

/**
 * Comparison of an expression against a literal.
 *
 * <p>The value is a scalar (String, Number, Boolean) for ordinary comparators,
 * a list for {@code IN}/{@code NOT IN}, and null for {@code IS [NOT] NULL}.
 */
public record Comparison(Expression operand, Comparator comparator, Object value) implements Predicate {

    public Comparison {
        Objects.requireNonNull(operand, "operand must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
    }
}
