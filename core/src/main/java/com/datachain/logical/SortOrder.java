package com.datachain.logical;

import com.datachain.expression.Expression;
import com.datachain.types.Sorting;

import java.util.Objects;

/**
 * ORDER BY entry of a query.
 */
public record SortOrder(Expression expression, Sorting sorting) {

    public SortOrder {
        Objects.requireNonNull(expression, "expression must not be null");
        sorting = sorting == null ? Sorting.ASC : sorting;
    }
}
