package com.datachain.semantic;

import com.datachain.types.DataType;

import java.util.Objects;

/**
 * A typed column of a semantic table.
 */
public record Column(String name, DataType type, String description) {

    public Column {
        Objects.requireNonNull(name, "column name must not be null");
        Objects.requireNonNull(type, "column type must not be null");
        description = description == null ? "" : description;
    }

    public static Column of(String name, DataType type) {
        return new Column(name, type, "");
    }
}
