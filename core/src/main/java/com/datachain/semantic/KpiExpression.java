package com.datachain.semantic;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Metric expression behind a KPI: a direct aggregation or a binary
 * combination of two other KPIs referenced by name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = KpiMetric.class, name = "metric"),
    @JsonSubTypes.Type(value = KpiBinary.class, name = "binary")
})
public sealed interface KpiExpression permits KpiMetric, KpiBinary {
}
