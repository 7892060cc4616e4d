package com.datachain.logical;

import com.datachain.expression.Expression;

import java.util.Objects;

/**
 * One entry of a SELECT list: {@code expression AS alias}.
 */
public record SelectItem(String alias, Expression expression) {

    public SelectItem {
        Objects.requireNonNull(alias, "alias must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
    }
}
