package com.datachain.validation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Stable machine-readable codes for query errors.
 *
 * <p>Codes serialize in lower snake case ({@code dimension_not_found}) and
 * must not be renamed once published: callers branch on them.
 */
public enum ErrorCode {
    // structure
    EMPTY_SELECTION,
    MULTIPLE_TIME_GRAINS,
    WINDOW_REQUIRES_TIME_GRAIN,
    INVALID_WINDOW_PERIOD,
    DUPLICATE_MEASURE_NAME,
    MISSING_FILTER_VALUE,
    INVALID_FILTER_VALUE,
    INVALID_LIMIT,

    // references
    KPI_NOT_FOUND,
    DUPLICATE_KPI,
    FILTER_NOT_FOUND,
    DUPLICATE_FILTER,
    DIMENSION_NOT_FOUND,
    INVALID_TIME_GRAIN,
    MEASURE_NOT_FOUND,
    INVALID_AGGREGATION,
    INVALID_FIELD_FORMAT,
    DIMENSION_FILTER_NOT_FOUND,
    MEASURE_FILTER_NOT_FOUND,
    WINDOW_MEASURE_FILTER,
    KPI_FILTER_NOT_FOUND,
    ORDER_BY_NOT_FOUND,

    // join path
    NO_COMMON_TABLE,
    NO_JOIN_PATH,

    // resolution
    UNRESOLVED_REFERENCE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return code();
    }
}
