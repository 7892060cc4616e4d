package com.datachain.expression;

import com.datachain.types.TimeGrain;

import java.util.Objects;

/**
 * Date column truncated to a time grain, rendered {@code GRAIN(table.column)}.
 */
public record TimeGrainColumn(String table, String name, TimeGrain grain) implements Expression {

    public TimeGrainColumn {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(name, "column name must not be null");
        Objects.requireNonNull(grain, "time grain must not be null");
    }
}
