package com.datachain.resolver;

import com.datachain.query.Measure;

import java.util.List;
import java.util.Objects;

/**
 * A single aggregation over one column, declared inline or taken from a
 * direct KPI.
 */
public record DirectMeasure(Measure measure) implements ResolvedMeasure {

    public DirectMeasure {
        Objects.requireNonNull(measure, "measure must not be null");
    }

    @Override
    public String name() {
        return measure.name();
    }

    @Override
    public List<String> tables() {
        return List.of(measure.table());
    }
}
