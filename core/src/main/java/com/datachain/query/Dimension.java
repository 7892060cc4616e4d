package com.datachain.query;

import com.datachain.types.TimeGrain;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Column to group by, optionally truncated to a time grain.
 */
public record Dimension(
        @JsonProperty("table") String table,
        @JsonProperty("column") String column,
        @JsonProperty("time_grain") TimeGrain timeGrain) {

    public Dimension {
        Objects.requireNonNull(table, "dimension table must not be null");
        Objects.requireNonNull(column, "dimension column must not be null");
    }

    public static Dimension of(String table, String column) {
        return new Dimension(table, column, null);
    }

    public static Dimension of(String table, String column, TimeGrain grain) {
        return new Dimension(table, column, grain);
    }

    public boolean hasTimeGrain() {
        return timeGrain != null;
    }

    /**
     * Returns the {@code table.column} reference used by filters and ordering.
     */
    public String ref() {
        return table + "." + column;
    }
}
