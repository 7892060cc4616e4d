package com.datachain.expression;

import com.datachain.expression.window.MeasureWindow;

import java.util.List;
import java.util.Objects;

/**
 * Window function over an already-aggregated field.
 *
 * <p>Only valid in the outer query of a staged (CTE) compilation, where
 * {@code field} refers to an aggregate computed by the inner query.
 *
 * @param field input expression, usually a CTE alias reference
 * @param partitionBy PARTITION BY expressions, may be empty
 * @param orderBy ORDER BY expressions of the window, may be empty
 * @param window the change or moving-average transform
 */
public record WindowSpec(Expression field, List<Expression> partitionBy, List<Expression> orderBy,
                         MeasureWindow window) implements Expression {

    public WindowSpec {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(window, "window must not be null");
        partitionBy = partitionBy == null ? List.of() : List.copyOf(partitionBy);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }
}
