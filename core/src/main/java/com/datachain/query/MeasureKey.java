package com.datachain.query;

import com.datachain.types.Aggregation;

/**
 * Structural identity of a measure: two measures with the same key compute
 * the same aggregate, whatever their names or windows.
 */
public record MeasureKey(String table, String column, Aggregation aggregation) {

    @Override
    public String toString() {
        return aggregation + "(" + table + "." + column + ")";
    }
}
