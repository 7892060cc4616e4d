package com.datachain.query;

import com.datachain.expression.window.MeasureWindow;
import com.datachain.types.Aggregation;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Named aggregation requested by a query, optionally windowed.
 *
 * <p>Record equality compares every field. Deduplication of aggregates goes
 * through {@link #key()}, which ignores the name and window.
 */
public record Measure(String name, String table, String column, Aggregation aggregation, MeasureWindow window) {

    public Measure {
        Objects.requireNonNull(name, "measure name must not be null");
        Objects.requireNonNull(table, "measure table must not be null");
        Objects.requireNonNull(column, "measure column must not be null");
        Objects.requireNonNull(aggregation, "measure aggregation must not be null");
    }

    public static Measure of(String name, String table, String column, Aggregation aggregation) {
        return new Measure(name, table, column, aggregation, null);
    }

    public MeasureKey key() {
        return new MeasureKey(table, column, aggregation);
    }

    @JsonIgnore
    public boolean isWindowed() {
        return window != null;
    }

    public Measure withWindow(MeasureWindow newWindow) {
        return new Measure(name, table, column, aggregation, newWindow);
    }
}
