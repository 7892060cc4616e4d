package com.datachain.semantic;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Predicate wrapped by a named filter.
 *
 * <p>Column comparisons become WHERE predicates; KPI comparisons become
 * HAVING predicates.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SemanticComparison.class, name = "comparison"),
    @JsonSubTypes.Type(value = KpiComparison.class, name = "kpi_comparison")
})
public sealed interface SemanticPredicate permits SemanticComparison, KpiComparison {
}
