package com.datachain.semantic;

import com.datachain.types.DataType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A named, reusable metric stored in the semantic model.
 */
public record Kpi(
        @JsonProperty("name") String name,
        @JsonProperty("expression") KpiExpression expression,
        @JsonProperty("description") String description,
        @JsonProperty("return_type") DataType returnType) {

    public Kpi {
        Objects.requireNonNull(name, "KPI name must not be null");
        Objects.requireNonNull(expression, "KPI expression must not be null");
        description = description == null ? "" : description;
        returnType = returnType == null ? DataType.NUMERIC : returnType;
    }

    public static Kpi metric(String name, KpiMetric metric) {
        return new Kpi(name, metric, "", DataType.NUMERIC);
    }

    public static Kpi binary(String name, KpiBinary binary) {
        return new Kpi(name, binary, "", DataType.NUMERIC);
    }
}
