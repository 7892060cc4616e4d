package com.datachain.resolver;

import com.datachain.types.Comparator;

/**
 * Row-level filter, compiled into WHERE.
 */
public record DimensionFilter(String table, String column, Comparator comparator, Object value) {
}
