package com.datachain.resolver;

import com.datachain.query.Dimension;

import java.util.List;

/**
 * Fully dereferenced query: nothing in it needs the semantic model any more.
 *
 * @param dimensions plain dimensions, in query order
 * @param timeGrainedDimensions dimensions carrying a time grain (at most one)
 * @param measures declared measures followed by KPI-derived measures
 * @param dimensionFilters WHERE filters
 * @param measureFilters HAVING filters
 * @param orderBy typed order-by entries
 * @param limit LIMIT, may be null
 * @param offset OFFSET, may be null
 */
public record ResolvedQuery(List<Dimension> dimensions,
                            List<Dimension> timeGrainedDimensions,
                            List<ResolvedMeasure> measures,
                            List<DimensionFilter> dimensionFilters,
                            List<MeasureFilter> measureFilters,
                            List<ResolvedOrderBy> orderBy,
                            Integer limit,
                            Integer offset) {

    public ResolvedQuery {
        dimensions = List.copyOf(dimensions);
        timeGrainedDimensions = List.copyOf(timeGrainedDimensions);
        measures = List.copyOf(measures);
        dimensionFilters = List.copyOf(dimensionFilters);
        measureFilters = List.copyOf(measureFilters);
        orderBy = List.copyOf(orderBy);
    }

    public boolean hasMeasures() {
        return !measures.isEmpty();
    }
}
