package com.datachain.semantic;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A table registered in the semantic model with its ordered columns.
 */
public record Table(String name, List<Column> columns, String description) {

    public Table {
        Objects.requireNonNull(name, "table name must not be null");
        columns = columns == null ? List.of() : List.copyOf(columns);
        description = description == null ? "" : description;
    }

    public static Table of(String name, Column... columns) {
        return new Table(name, List.of(columns), "");
    }

    public Optional<Column> column(String columnName) {
        for (Column column : columns) {
            if (column.name().equals(columnName)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public boolean hasColumn(String columnName) {
        return column(columnName).isPresent();
    }
}
