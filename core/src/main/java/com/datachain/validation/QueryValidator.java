package com.datachain.validation;

import com.datachain.exception.DuplicateEntityException;
import com.datachain.exception.MissingEntityException;
import com.datachain.query.Dimension;
import com.datachain.query.Measure;
import com.datachain.query.OrderBy;
import com.datachain.query.Query;
import com.datachain.query.QueryContext;
import com.datachain.query.QueryFilter;
import com.datachain.semantic.Kpi;
import com.datachain.semantic.KpiBinary;
import com.datachain.semantic.KpiComparison;
import com.datachain.semantic.SemanticFilter;
import com.datachain.semantic.SemanticModel;
import com.datachain.types.Comparator;
import com.datachain.types.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Validates a submitted query before and after resolution.
 *
 * <p>Validation rules:
 * <ul>
 *   <li><b>Structure</b> (no model needed):
 *     <ul>
 *       <li>at least one dimension, measure or KPI ref is selected</li>
 *       <li>at most one dimension carries a time grain</li>
 *       <li>windowed measures need a time-grained dimension and a positive period</li>
 *       <li>measure and KPI names are unique</li>
 *       <li>filter values match their comparator (none, scalar or list)</li>
 *       <li>limit and offset are not negative</li>
 *     </ul>
 *   </li>
 *   <li><b>References</b>: every KPI (including the operands of binary KPIs and
 *       the KPIs named by filter refs), filter, column, measure filter target and
 *       order-by field exists, time grains apply to DATE columns and SUM/AVG
 *       apply to NUMERIC columns</li>
 *   <li><b>Join path</b> (after resolution): all touched tables share a
 *       reachable common table, and each of them can join to it</li>
 * </ul>
 *
 * <p>Each pass accumulates every error it finds instead of stopping at the
 * first one. The validator holds no state and may be shared.
 *
 * @see QueryError
 */
public class QueryValidator {

    private static final Logger logger = LoggerFactory.getLogger(QueryValidator.class);

    // ==================== Structure ====================

    /**
     * Checks the query's shape without consulting the semantic model.
     *
     * @param query the query to check
     * @param ctx the query's planning context, used for tracing
     * @return every structural error found, empty when valid
     */
    public List<QueryError> validateStructure(Query query, QueryContext ctx) {
        Objects.requireNonNull(query, "query must not be null");
        List<QueryError> errors = new ArrayList<>();

        if (query.dimensions().isEmpty() && query.measures().isEmpty() && query.kpiRefs().isEmpty()) {
            errors.add(structure(ErrorCode.EMPTY_SELECTION,
                "Query must select at least one dimension, measure, or KPI",
                "Add a dimension, a measure or a kpi_ref"));
        }

        long timeGrained = query.dimensions().stream().filter(Dimension::hasTimeGrain).count();
        if (timeGrained > 1) {
            errors.add(structure(ErrorCode.MULTIPLE_TIME_GRAINS,
                "Query has " + timeGrained + " time-grained dimensions; at most one is allowed",
                "Keep the time grain on a single date dimension"));
        }

        for (Measure measure : query.measures()) {
            if (!measure.isWindowed()) {
                continue;
            }
            if (timeGrained == 0) {
                errors.add(structure(ErrorCode.WINDOW_REQUIRES_TIME_GRAIN,
                    "Measure '" + measure.name() + "' has a window but no dimension has a time grain",
                    "Add a date dimension with a time_grain to order the window by"));
            }
            if (measure.window().period() < 1) {
                errors.add(structure(ErrorCode.INVALID_WINDOW_PERIOD,
                    "Measure '" + measure.name() + "' has window period " + measure.window().period()
                        + "; the period must be at least 1", null));
            }
        }

        Set<String> names = new HashSet<>();
        for (Measure measure : query.measures()) {
            if (!names.add(measure.name())) {
                errors.add(duplicateName(measure.name()));
            }
        }
        for (String kpiRef : query.kpiRefs()) {
            if (!names.add(kpiRef)) {
                errors.add(duplicateName(kpiRef));
            }
        }

        checkFilterValues(query.dimensionFilters(), errors);
        checkFilterValues(query.measureFilters(), errors);
        checkFilterValues(query.kpiFilters(), errors);

        if (query.limit() != null && query.limit() < 0) {
            errors.add(structure(ErrorCode.INVALID_LIMIT, "Limit must not be negative, got " + query.limit(), null));
        }
        if (query.offset() != null && query.offset() < 0) {
            errors.add(structure(ErrorCode.INVALID_LIMIT, "Offset must not be negative, got " + query.offset(), null));
        }

        ctx.trace("structure validation: " + errors.size() + " error(s)");
        return errors;
    }

    private void checkFilterValues(List<QueryFilter> filters, List<QueryError> errors) {
        for (QueryFilter filter : filters) {
            Comparator comparator = filter.comparator();
            Object value = filter.value();
            String label = "Filter on '" + filter.field() + "' (" + comparator.symbol() + ")";

            if (comparator.isNullCheck()) {
                if (value != null) {
                    errors.add(structure(ErrorCode.INVALID_FILTER_VALUE,
                        label + " takes no value", "Remove the value"));
                }
            } else if (value == null) {
                errors.add(structure(ErrorCode.MISSING_FILTER_VALUE, label + " requires a value", null));
            } else if (comparator.isMembership()) {
                if (!(value instanceof Collection<?> values) || values.isEmpty()) {
                    errors.add(structure(ErrorCode.INVALID_FILTER_VALUE,
                        label + " requires a non-empty list of values", "Use a list such as [\"a\", \"b\"]"));
                }
            } else if (value instanceof Collection<?>) {
                errors.add(structure(ErrorCode.INVALID_FILTER_VALUE,
                    label + " requires a single value, got a list", "Use IN or NOT IN to compare against a list"));
            }
        }
    }

    private static QueryError duplicateName(String name) {
        return structure(ErrorCode.DUPLICATE_MEASURE_NAME,
            "Measure or KPI name '" + name + "' is used more than once",
            "Give every measure a unique name");
    }

    private static QueryError structure(ErrorCode code, String message, String hint) {
        return new QueryError(ErrorStage.STRUCTURE_VALIDATION, code, message, hint);
    }

    // ==================== References ====================

    /**
     * Checks every name the query uses against the semantic model.
     *
     * @param query a structurally valid query
     * @param model the semantic model
     * @param ctx the query's planning context, used for tracing
     * @return every reference error found, empty when valid
     */
    public List<QueryError> validateReferences(Query query, SemanticModel model, QueryContext ctx) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(model, "model must not be null");
        List<QueryError> errors = new ArrayList<>();

        Set<String> checkedKpis = new HashSet<>();
        for (String kpiRef : query.kpiRefs()) {
            checkKpi(model, kpiRef, ErrorCode.KPI_NOT_FOUND, "KPI", checkedKpis, errors);
        }

        for (String filterRef : query.filterRefs()) {
            try {
                SemanticFilter filter = model.getFilter(filterRef);
                if (filter.predicate() instanceof KpiComparison comparison) {
                    checkKpi(model, comparison.kpi(), ErrorCode.KPI_NOT_FOUND,
                        "KPI of filter '" + filterRef + "'", checkedKpis, errors);
                }
            } catch (MissingEntityException e) {
                errors.add(reference(ErrorCode.FILTER_NOT_FOUND,
                    "Filter '" + filterRef + "' does not exist in the semantic model", null));
            } catch (DuplicateEntityException e) {
                errors.add(reference(ErrorCode.DUPLICATE_FILTER,
                    "Filter '" + filterRef + "' is defined " + e.getMatchCount() + " times in the semantic model",
                    null));
            }
        }

        for (Dimension dimension : query.dimensions()) {
            Optional<DataType> type = model.columnType(dimension.table(), dimension.column());
            if (type.isEmpty()) {
                errors.add(reference(ErrorCode.DIMENSION_NOT_FOUND,
                    "Dimension '" + dimension.ref() + "' does not exist in the semantic model",
                    tableHint(model, dimension.table())));
            } else if (dimension.hasTimeGrain() && type.get() != DataType.DATE) {
                errors.add(reference(ErrorCode.INVALID_TIME_GRAIN,
                    "Time grain " + dimension.timeGrain() + " applied to '" + dimension.ref()
                        + "' of type " + type.get() + "; time grains require a DATE column", null));
            }
        }

        for (Measure measure : query.measures()) {
            Optional<DataType> type = model.columnType(measure.table(), measure.column());
            if (type.isEmpty()) {
                errors.add(reference(ErrorCode.MEASURE_NOT_FOUND,
                    "Measure '" + measure.name() + "' references unknown column '"
                        + measure.table() + "." + measure.column() + "'",
                    tableHint(model, measure.table())));
            } else if (measure.aggregation().requiresNumeric() && type.get() != DataType.NUMERIC) {
                errors.add(reference(ErrorCode.INVALID_AGGREGATION,
                    measure.aggregation() + " applied to '" + measure.table() + "." + measure.column()
                        + "' of type " + type.get() + "; it requires a NUMERIC column",
                    "Use COUNT, COUNT_DISTINCT, MIN or MAX for non-numeric columns"));
            }
        }

        for (QueryFilter filter : query.dimensionFilters()) {
            if (!filter.hasQualifiedField()) {
                errors.add(reference(ErrorCode.INVALID_FIELD_FORMAT,
                    "Dimension filter field '" + filter.field() + "' must have the form table.column", null));
            } else if (!model.fieldExists(filter.table(), filter.column())) {
                errors.add(reference(ErrorCode.DIMENSION_FILTER_NOT_FOUND,
                    "Dimension filter field '" + filter.field() + "' does not exist in the semantic model",
                    tableHint(model, filter.table())));
            }
        }

        Map<String, Measure> measuresByName = new LinkedHashMap<>();
        for (Measure measure : query.measures()) {
            measuresByName.putIfAbsent(measure.name(), measure);
        }
        Set<String> kpiRefs = new HashSet<>(query.kpiRefs());

        for (QueryFilter filter : query.measureFilters()) {
            Measure target = measuresByName.get(filter.field());
            if (target == null && !kpiRefs.contains(filter.field())) {
                errors.add(reference(ErrorCode.MEASURE_FILTER_NOT_FOUND,
                    "Measure filter field '" + filter.field() + "' is not a measure or KPI of this query",
                    "Filter on one of: " + selectableNames(query)));
            } else if (target != null && target.isWindowed()) {
                errors.add(reference(ErrorCode.WINDOW_MEASURE_FILTER,
                    "Measure filter on windowed measure '" + filter.field() + "' is not supported",
                    "Filter on the unwindowed measure instead"));
            }
        }

        for (QueryFilter filter : query.kpiFilters()) {
            checkKpi(model, filter.field(), ErrorCode.KPI_FILTER_NOT_FOUND, "KPI filter", checkedKpis, errors);
        }

        Set<String> dimensionRefs = new HashSet<>();
        for (Dimension dimension : query.dimensions()) {
            dimensionRefs.add(dimension.ref());
        }
        for (OrderBy order : query.orderBy()) {
            boolean known = order.isDimensionRef()
                ? dimensionRefs.contains(order.field())
                : measuresByName.containsKey(order.field()) || kpiRefs.contains(order.field());
            if (!known) {
                errors.add(reference(ErrorCode.ORDER_BY_NOT_FOUND,
                    "Order by field '" + order.field() + "' is not a selected dimension, measure or KPI",
                    "Order by a selected table.column dimension or one of: " + selectableNames(query)));
            }
        }

        ctx.trace("reference validation: " + errors.size() + " error(s)");
        return errors;
    }

    /**
     * Looks up a KPI and, for binary KPIs, every KPI it is built from.
     * Each name is reported at most once per query.
     */
    private void checkKpi(SemanticModel model, String name, ErrorCode missingCode, String label,
                          Set<String> checked, List<QueryError> errors) {
        if (!checked.add(name)) {
            return;
        }
        Kpi kpi;
        try {
            kpi = model.getKpi(name);
        } catch (MissingEntityException e) {
            errors.add(reference(missingCode,
                label + " '" + name + "' does not exist in the semantic model", null));
            return;
        } catch (DuplicateEntityException e) {
            errors.add(reference(ErrorCode.DUPLICATE_KPI,
                "KPI '" + name + "' is defined " + e.getMatchCount() + " times in the semantic model", null));
            return;
        }
        if (kpi.expression() instanceof KpiBinary binary) {
            String operandLabel = "Operand of KPI '" + name + "'";
            checkKpi(model, binary.left(), ErrorCode.KPI_NOT_FOUND, operandLabel, checked, errors);
            checkKpi(model, binary.right(), ErrorCode.KPI_NOT_FOUND, operandLabel, checked, errors);
        }
    }

    private static String tableHint(SemanticModel model, String table) {
        return model.getTable(table)
            .map(t -> "Columns of '" + table + "': " + t.columns().stream().map(c -> c.name()).toList())
            .orElse("Unknown table '" + table + "'");
    }

    private static List<String> selectableNames(Query query) {
        List<String> names = new ArrayList<>();
        query.measures().forEach(m -> names.add(m.name()));
        names.addAll(query.kpiRefs());
        return names;
    }

    private static QueryError reference(ErrorCode code, String message, String hint) {
        return new QueryError(ErrorStage.REFERENCE_VALIDATION, code, message, hint);
    }

    // ==================== Join path ====================

    /**
     * Picks the common table every touched table joins into.
     *
     * <p>Distances are breadth-first over the undirected relationship graph.
     * Among tables reachable from every touched table, the one with the
     * smallest distance sum wins. Ties prefer a table that every touched table
     * reaches along relationship direction, then the lexicographically
     * smallest name. On success {@code ctx.getCommonTable()} is set.
     *
     * @param model the semantic model
     * @param ctx context whose tables were filled by the resolver
     * @return join path errors, empty when a common table was chosen
     */
    public List<QueryError> validateJoinPath(SemanticModel model, QueryContext ctx) {
        Objects.requireNonNull(model, "model must not be null");
        List<QueryError> errors = new ArrayList<>();
        Set<String> tables = ctx.getTables();

        if (tables.isEmpty()) {
            return errors;
        }
        if (tables.size() == 1) {
            String only = tables.iterator().next();
            ctx.setCommonTable(only);
            ctx.trace("join path: single table '" + only + "'");
            return errors;
        }

        Map<String, List<String>> undirected = model.getRelationshipGraph(false);
        Map<String, List<String>> directed = model.getRelationshipGraph(true);

        Map<String, Map<String, Integer>> distances = new LinkedHashMap<>();
        for (String table : tables) {
            distances.put(table, bfsDistances(table, undirected));
        }

        Set<String> common = null;
        for (Map<String, Integer> reach : distances.values()) {
            if (common == null) {
                common = new HashSet<>(reach.keySet());
            } else {
                common.retainAll(reach.keySet());
            }
        }

        if (common == null || common.isEmpty()) {
            errors.add(new QueryError(ErrorStage.JOIN_PATH_VALIDATION, ErrorCode.NO_COMMON_TABLE,
                "No common table is reachable from all of " + tables,
                "Query tables that are connected by relationships"));
            return errors;
        }

        Map<String, Set<String>> directedReach = new HashMap<>();
        for (String table : tables) {
            directedReach.put(table, bfsDistances(table, directed).keySet());
        }

        String best = null;
        int bestSum = Integer.MAX_VALUE;
        boolean bestDirected = false;
        for (String candidate : common) {
            int sum = 0;
            boolean reachedByAll = true;
            for (String table : tables) {
                sum += distances.get(table).get(candidate);
                reachedByAll &= directedReach.get(table).contains(candidate);
            }
            if (best == null
                    || sum < bestSum
                    || (sum == bestSum && reachedByAll && !bestDirected)
                    || (sum == bestSum && reachedByAll == bestDirected && candidate.compareTo(best) < 0)) {
                best = candidate;
                bestSum = sum;
                bestDirected = reachedByAll;
            }
        }

        ctx.setCommonTable(best);
        ctx.trace("join path: common table '" + best + "' (distance sum " + bestSum + ", candidates "
            + common.size() + ")");

        for (String table : tables) {
            if (!directedReach.get(table).contains(best)) {
                errors.add(new QueryError(ErrorStage.JOIN_PATH_VALIDATION, ErrorCode.NO_JOIN_PATH,
                    "Table '" + table + "' has no relationship path to common table '" + best + "'",
                    "Relationships are followed from the one side to the many side"));
            }
        }

        logger.debug("Common table for {} is {} ({} join path errors)", tables, best, errors.size());
        return errors;
    }

    /**
     * Breadth-first distances from {@code start} to every reachable table,
     * including itself at distance 0.
     */
    static Map<String, Integer> bfsDistances(String start, Map<String, List<String>> graph) {
        Map<String, Integer> visited = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.put(start, 0);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            int distance = visited.get(current);
            for (String neighbour : graph.getOrDefault(current, List.of())) {
                if (!visited.containsKey(neighbour)) {
                    visited.put(neighbour, distance + 1);
                    queue.add(neighbour);
                }
            }
        }
        return visited;
    }
}
