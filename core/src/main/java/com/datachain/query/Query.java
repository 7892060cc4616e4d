package com.datachain.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured query submitted by a caller.
 *
 * <p>Missing lists are normalized to empty lists, so stages never check for null.
 *
 * <p>Example usage:
 * <pre>
 *   Query query = Query.builder()
 *       .dimension(Dimension.of("customers", "customer_name"))
 *       .kpiRef("total_revenue")
 *       .filterRef("high_value_customers")
 *       .orderBy(OrderBy.desc("total_revenue"))
 *       .limit(10)
 *       .build();
 * </pre>
 */
public record Query(
        @JsonProperty("dimensions") List<Dimension> dimensions,
        @JsonProperty("measures") List<Measure> measures,
        @JsonProperty("kpi_refs") List<String> kpiRefs,
        @JsonProperty("dimension_filters") List<QueryFilter> dimensionFilters,
        @JsonProperty("measure_filters") List<QueryFilter> measureFilters,
        @JsonProperty("kpi_filters") List<QueryFilter> kpiFilters,
        @JsonProperty("filter_refs") List<String> filterRefs,
        @JsonProperty("order_by") List<OrderBy> orderBy,
        @JsonProperty("limit") Integer limit,
        @JsonProperty("offset") Integer offset) {

    public Query {
        dimensions = copy(dimensions);
        measures = copy(measures);
        kpiRefs = copy(kpiRefs);
        dimensionFilters = copy(dimensionFilters);
        measureFilters = copy(measureFilters);
        kpiFilters = copy(kpiFilters);
        filterRefs = copy(filterRefs);
        orderBy = copy(orderBy);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Dimension> dimensions = new ArrayList<>();
        private final List<Measure> measures = new ArrayList<>();
        private final List<String> kpiRefs = new ArrayList<>();
        private final List<QueryFilter> dimensionFilters = new ArrayList<>();
        private final List<QueryFilter> measureFilters = new ArrayList<>();
        private final List<QueryFilter> kpiFilters = new ArrayList<>();
        private final List<String> filterRefs = new ArrayList<>();
        private final List<OrderBy> orderBy = new ArrayList<>();
        private Integer limit;
        private Integer offset;

        private Builder() {
        }

        public Builder dimension(Dimension dimension) {
            dimensions.add(dimension);
            return this;
        }

        public Builder measure(Measure measure) {
            measures.add(measure);
            return this;
        }

        public Builder kpiRef(String name) {
            kpiRefs.add(name);
            return this;
        }

        public Builder dimensionFilter(QueryFilter filter) {
            dimensionFilters.add(filter);
            return this;
        }

        public Builder measureFilter(QueryFilter filter) {
            measureFilters.add(filter);
            return this;
        }

        public Builder kpiFilter(QueryFilter filter) {
            kpiFilters.add(filter);
            return this;
        }

        public Builder filterRef(String name) {
            filterRefs.add(name);
            return this;
        }

        public Builder orderBy(OrderBy order) {
            orderBy.add(order);
            return this;
        }

        public Builder limit(Integer value) {
            this.limit = value;
            return this;
        }

        public Builder offset(Integer value) {
            this.offset = value;
            return this;
        }

        public Query build() {
            return new Query(dimensions, measures, kpiRefs, dimensionFilters, measureFilters,
                kpiFilters, filterRefs, orderBy, limit, offset);
        }
    }
}
