package com.datachain.expression;

import com.datachain.types.Arithmetic;

import java.util.Objects;

/**
 * Arithmetic combination of two expressions, rendered fully parenthesized.
 */
public record BinaryMetric(Expression left, Arithmetic operator, Expression right) implements Expression {

    public BinaryMetric {
        Objects.requireNonNull(left, "left operand must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(right, "right operand must not be null");
    }
}
