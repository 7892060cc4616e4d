package com.datachain.resolver;

import java.util.List;

/**
 * Measure after KPI references have been dereferenced.
 */
public sealed interface ResolvedMeasure permits DirectMeasure, DerivedMeasure {

    /**
     * Output name of the measure, used as its select alias.
     */
    String name();

    /**
     * Tables the measure aggregates over.
     */
    List<String> tables();
}
