package com.datachain.semantic;

import com.datachain.types.Comparator;

import java.util.Objects;

/**
 * Comparison of an aggregated KPI against a number.
 */
public record KpiComparison(String kpi, Comparator comparator, Number value) implements SemanticPredicate {

    public KpiComparison {
        Objects.requireNonNull(kpi, "kpi must not be null");
        Objects.requireNonNull(comparator, "comparator must not be null");
    }
}
