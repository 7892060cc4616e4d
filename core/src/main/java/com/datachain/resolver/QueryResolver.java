package com.datachain.resolver;

import com.datachain.exception.DuplicateEntityException;
import com.datachain.exception.MissingEntityException;
import com.datachain.exception.QueryResolutionException;
import com.datachain.expression.AggregateMeasure;
import com.datachain.expression.BinaryMetric;
import com.datachain.expression.Expression;
import com.datachain.query.Dimension;
import com.datachain.query.Measure;
import com.datachain.query.OrderBy;
import com.datachain.query.Query;
import com.datachain.query.QueryContext;
import com.datachain.query.QueryFilter;
import com.datachain.semantic.Kpi;
import com.datachain.semantic.KpiBinary;
import com.datachain.semantic.KpiComparison;
import com.datachain.semantic.KpiExpression;
import com.datachain.semantic.KpiMetric;
import com.datachain.semantic.SemanticComparison;
import com.datachain.semantic.SemanticFilter;
import com.datachain.semantic.SemanticModel;
import com.datachain.semantic.SemanticPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Turns a validated query into a self-contained {@link ResolvedQuery}.
 *
 * <p>KPI refs become measures (binary KPIs become {@link DerivedMeasure}s),
 * filter refs are split into WHERE and HAVING filters, and order-by fields are
 * typed as dimension or measure references. Every table the result touches
 * is added to the context.
 *
 * <p>A name that fails to resolve here got past reference validation and is
 * reported as a {@link QueryResolutionException}.
 */
public class QueryResolver {

    private static final Logger logger = LoggerFactory.getLogger(QueryResolver.class);

    /**
     * Resolves a query against the semantic model.
     *
     * @param query a query that passed structure and reference validation
     * @param model the semantic model
     * @param ctx context receiving the set of touched tables
     * @return the resolved query
     * @throws QueryResolutionException if a reference cannot be resolved
     */
    public ResolvedQuery resolve(Query query, SemanticModel model, QueryContext ctx) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(model, "model must not be null");

        List<Dimension> plain = new ArrayList<>();
        List<Dimension> grained = new ArrayList<>();
        for (Dimension dimension : query.dimensions()) {
            (dimension.hasTimeGrain() ? grained : plain).add(dimension);
        }

        List<ResolvedMeasure> measures = new ArrayList<>();
        for (Measure measure : query.measures()) {
            measures.add(new DirectMeasure(measure));
        }
        for (String kpiRef : query.kpiRefs()) {
            measures.add(resolveKpi(kpiRef, model));
        }

        List<DimensionFilter> dimensionFilters = new ArrayList<>();
        List<MeasureFilter> measureFilters = new ArrayList<>();

        for (String filterRef : query.filterRefs()) {
            SemanticFilter filter = lookup(() -> model.getFilter(filterRef), "filter", filterRef);
            SemanticPredicate predicate = filter.predicate();
            if (predicate instanceof SemanticComparison comparison) {
                dimensionFilters.add(new DimensionFilter(comparison.table(), comparison.column(),
                    comparison.comparator(), comparison.value()));
            } else if (predicate instanceof KpiComparison comparison) {
                measureFilters.add(new MeasureFilter(resolveKpi(comparison.kpi(), model),
                    comparison.comparator(), comparison.value()));
            }
        }

        for (QueryFilter filter : query.dimensionFilters()) {
            dimensionFilters.add(new DimensionFilter(filter.table(), filter.column(),
                filter.comparator(), filter.value()));
        }

        for (QueryFilter filter : query.measureFilters()) {
            measureFilters.add(new MeasureFilter(findMeasure(measures, filter.field()),
                filter.comparator(), filter.value()));
        }

        for (QueryFilter filter : query.kpiFilters()) {
            measureFilters.add(new MeasureFilter(resolveKpi(filter.field(), model),
                filter.comparator(), filter.value()));
        }

        List<ResolvedOrderBy> orderBy = new ArrayList<>();
        for (OrderBy order : query.orderBy()) {
            if (order.isDimensionRef()) {
                orderBy.add(new ResolvedOrderBy.ByDimension(findDimension(query.dimensions(), order.field()),
                    order.sorting()));
            } else {
                orderBy.add(new ResolvedOrderBy.ByMeasure(findMeasure(measures, order.field()), order.sorting()));
            }
        }

        for (Dimension dimension : query.dimensions()) {
            ctx.addTable(dimension.table());
        }
        for (ResolvedMeasure measure : measures) {
            measure.tables().forEach(ctx::addTable);
        }
        for (DimensionFilter filter : dimensionFilters) {
            ctx.addTable(filter.table());
        }
        for (MeasureFilter filter : measureFilters) {
            filter.measure().tables().forEach(ctx::addTable);
        }

        ctx.trace("resolved " + measures.size() + " measure(s), " + dimensionFilters.size()
            + " dimension filter(s), " + measureFilters.size() + " measure filter(s); tables "
            + ctx.getTables());
        logger.debug("Resolved query touching tables {}", ctx.getTables());

        return new ResolvedQuery(plain, grained, measures, dimensionFilters, measureFilters, orderBy,
            query.limit(), query.offset());
    }

    /**
     * Resolves a KPI by name to a direct or derived measure named after the KPI.
     */
    ResolvedMeasure resolveKpi(String name, SemanticModel model) {
        Kpi kpi = lookup(() -> model.getKpi(name), "KPI", name);
        KpiExpression expression = kpi.expression();
        if (expression instanceof KpiMetric metric) {
            return new DirectMeasure(
                Measure.of(kpi.name(), metric.table(), metric.column(), metric.aggregation()));
        }
        Set<String> tables = new LinkedHashSet<>();
        Expression lowered = lowerKpi(kpi, model, tables);
        return new DerivedMeasure(kpi.name(), lowered, new ArrayList<>(tables));
    }

    private Expression lowerKpi(Kpi kpi, SemanticModel model, Set<String> tables) {
        KpiExpression expression = kpi.expression();
        if (expression instanceof KpiMetric metric) {
            tables.add(metric.table());
            return new AggregateMeasure(metric.table(), metric.column(), metric.aggregation());
        }
        KpiBinary binary = (KpiBinary) expression;
        Kpi left = lookup(() -> model.getKpi(binary.left()), "KPI", binary.left());
        Kpi right = lookup(() -> model.getKpi(binary.right()), "KPI", binary.right());
        return new BinaryMetric(lowerKpi(left, model, tables), binary.operator(), lowerKpi(right, model, tables));
    }

    private static ResolvedMeasure findMeasure(List<ResolvedMeasure> measures, String name) {
        for (ResolvedMeasure measure : measures) {
            if (measure.name().equals(name)) {
                return measure;
            }
        }
        throw new QueryResolutionException("No measure or KPI named '" + name + "' in the query");
    }

    private static Dimension findDimension(List<Dimension> dimensions, String ref) {
        for (Dimension dimension : dimensions) {
            if (dimension.ref().equals(ref)) {
                return dimension;
            }
        }
        throw new QueryResolutionException("Order by field '" + ref + "' is not a selected dimension");
    }

    private static <T> T lookup(Supplier<T> lookup, String kind, String name) {
        try {
            return lookup.get();
        } catch (MissingEntityException | DuplicateEntityException e) {
            throw new QueryResolutionException("Cannot resolve " + kind + " '" + name + "': " + e.getMessage(), e);
        }
    }
}
