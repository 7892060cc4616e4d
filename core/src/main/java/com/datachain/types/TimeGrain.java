package com.datachain.types;

/**
 * Grains for time-grained dimensions.
 *
 * <p>Each grain renders as a DuckDB function of the same name applied to the
 * column, e.g. {@code MONTH(orders.order_date)}. In DuckDB these functions
 * extract a date part rather than truncate, so {@code MONTH} yields 1-12 and
 * months of different years fall into the same group. Only {@code YEAR} keeps
 * years apart.
 */
public enum TimeGrain {
    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH,
    QUARTER,
    YEAR;

    public String functionName() {
        return name();
    }
}
