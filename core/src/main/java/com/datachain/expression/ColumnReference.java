package com.datachain.expression;

import java.util.Objects;

/**
 * Reference to a column, optionally qualified by its table or CTE name.
 */
public record ColumnReference(String table, String name) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(name, "column name must not be null");
    }

    public static ColumnReference of(String table, String name) {
        return new ColumnReference(table, name);
    }

    /**
     * Creates an unqualified reference, used for select-list aliases.
     */
    public static ColumnReference alias(String name) {
        return new ColumnReference(null, name);
    }

    public boolean isQualified() {
        return table != null;
    }
}
