package com.datachain.semantic;

import com.datachain.types.Arithmetic;

import java.util.Objects;

/**
 * Arithmetic combination of two KPIs, referenced by name.
 *
 * @param left name of the left operand KPI
 * @param operator arithmetic operator
 * @param right name of the right operand KPI
 */
public record KpiBinary(String left, Arithmetic operator, String right) implements KpiExpression {

    public KpiBinary {
        Objects.requireNonNull(left, "left KPI must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(right, "right KPI must not be null");
    }
}
