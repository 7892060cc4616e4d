package com.datachain.semantic;

import com.datachain.types.Comparator;

import java.util.Objects;

/**
 * Comparison of a column against a literal value (scalar or list).
 */
public record SemanticComparison(String table, String column, Comparator comparator, Object value)
        implements SemanticPredicate {

    public SemanticComparison {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(column, "column must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
    }
}
