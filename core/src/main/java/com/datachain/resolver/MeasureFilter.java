package com.datachain.resolver;

import com.datachain.types.Comparator;

/**
 * Filter on an aggregated measure, compiled into HAVING.
 */
public record MeasureFilter(ResolvedMeasure measure, Comparator comparator, Object value) {
}
