package com.datachain.resolver;

import com.datachain.expression.Expression;

import java.util.List;
import java.util.Objects;

/**
 * A binary KPI lowered to an arithmetic tree whose leaves are aggregations.
 *
 * <p>For {@code profit_margin = total_profit / total_revenue} with
 * {@code total_profit = total_revenue - total_cost} the expression is
 * {@code ((SUM(revenue) - SUM(cost)) / SUM(revenue))}.
 */
public record DerivedMeasure(String name, Expression expression, List<String> tables) implements ResolvedMeasure {

    public DerivedMeasure {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(expression, "expression must not be null");
        tables = List.copyOf(tables);
    }
}
