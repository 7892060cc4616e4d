package com.datachain.planner;

import com.datachain.config.CompilerSettings;
import com.datachain.expression.AggregateMeasure;
import com.datachain.expression.And;
import com.datachain.expression.ColumnComparison;
import com.datachain.expression.ColumnReference;
import com.datachain.expression.Comparison;
import com.datachain.expression.Expression;
import com.datachain.expression.Predicate;
import com.datachain.expression.TimeGrainColumn;
import com.datachain.expression.WindowSpec;
import com.datachain.logical.JoinType;
import com.datachain.logical.SortOrder;
import com.datachain.logical.SqlJoin;
import com.datachain.logical.SqlQuery;
import com.datachain.query.Dimension;
import com.datachain.query.Measure;
import com.datachain.query.MeasureKey;
import com.datachain.query.QueryContext;
import com.datachain.resolver.DerivedMeasure;
import com.datachain.resolver.DimensionFilter;
import com.datachain.resolver.DirectMeasure;
import com.datachain.resolver.MeasureFilter;
import com.datachain.resolver.ResolvedMeasure;
import com.datachain.resolver.ResolvedOrderBy;
import com.datachain.resolver.ResolvedQuery;
import com.datachain.semantic.Relationship;
import com.datachain.semantic.SemanticModel;
import com.datachain.semantic.TableEdge;
import com.datachain.types.Comparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the SQL AST for a resolved query.
 *
 * <p>Planning runs in two steps:
 * <ol>
 *   <li>{@link #analyseContext} records the distinct aggregates, pairs every
 *       windowed measure with the aggregate its window reads, decides whether
 *       a CTE is needed and collects the join edges from each touched table to
 *       the common table.</li>
 *   <li>{@link #plan} assembles the select list, joins, WHERE, GROUP BY,
 *       HAVING, ORDER BY and LIMIT into a flat query, or into an aggregating
 *       inner query wrapped by a windowing outer query.</li>
 * </ol>
 *
 * <p>Join paths come from a depth-first search along relationship direction
 * and use the first path found, which is not necessarily the shortest.
 *
 * <p>Select aliases: a measure keeps its name; a dimension uses its column
 * name, or {@code table_column} when that clashes; a time-grained dimension
 * uses {@code grain_column}, e.g. {@code month_order_date}.
 */
public class QueryPlanner {

    private static final Logger logger = LoggerFactory.getLogger(QueryPlanner.class);

    private final CompilerSettings settings;

    public QueryPlanner() {
        this(CompilerSettings.defaults());
    }

    public QueryPlanner(CompilerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    // ==================== Analysis ====================

    /**
     * Fills the context's measure bookkeeping, CTE flag and join edges.
     *
     * @param resolved the resolved query
     * @param ctx context with tables and common table already set
     * @param model the semantic model
     * @throws IllegalStateException if no common table was chosen or a touched
     *         table has no path to it
     */
    public void analyseContext(ResolvedQuery resolved, QueryContext ctx, SemanticModel model) {
        Objects.requireNonNull(resolved, "resolved query must not be null");
        Objects.requireNonNull(model, "model must not be null");

        Set<String> usedNames = new HashSet<>();
        for (ResolvedMeasure measure : resolved.measures()) {
            usedNames.add(measure.name());
        }

        for (ResolvedMeasure resolvedMeasure : resolved.measures()) {
            if (resolvedMeasure instanceof DirectMeasure direct && !direct.measure().isWindowed()) {
                ctx.putUniqueMeasure(direct.measure().key(), direct.name());
            }
        }

        for (ResolvedMeasure resolvedMeasure : resolved.measures()) {
            if (!(resolvedMeasure instanceof DirectMeasure direct) || !direct.measure().isWindowed()) {
                continue;
            }
            Measure measure = direct.measure();
            ctx.setRequiresCte(true);
            ctx.addWindowMeasure(measure);

            String twin = ctx.getUniqueMeasures().get(measure.key());
            if (twin == null) {
                twin = uniqueName(measure.name() + "_base", usedNames);
                ctx.putUniqueMeasure(measure.key(), twin);
                ctx.warn("Windowed measure '" + measure.name() + "' has no unwindowed twin; computing "
                    + measure.key() + " as '" + twin + "'");
            }
            usedNames.add(twin);
            ctx.mapWindowMeasure(measure.name(), twin);
        }

        String common = ctx.getCommonTable();
        if (common == null) {
            throw new IllegalStateException("No common table chosen; join path validation must run first");
        }

        if (ctx.getTables().size() > 1) {
            Map<String, List<String>> graph = model.getRelationshipGraph(true);
            for (String table : ctx.getTables()) {
                if (table.equals(common)) {
                    continue;
                }
                List<TableEdge> path = findJoinPath(table, common, graph, new HashSet<>());
                if (path == null) {
                    throw new IllegalStateException("No join path from '" + table + "' to common table '"
                        + common + "'; join path validation must reject this query");
                }
                Collections.reverse(path);
                for (TableEdge edge : path) {
                    ctx.addJoin(edge);
                }
            }
        }

        ctx.trace("analyse: " + ctx.getUniqueMeasures().size() + " unique measure(s), "
            + ctx.getWindowMeasures().size() + " window measure(s), joins " + ctx.getJoins()
            + ", requires CTE: " + ctx.requiresCte());
    }

    /**
     * Depth-first search along relationship direction; returns the first path
     * found as edges ordered from {@code from} towards {@code target}.
     */
    private static List<TableEdge> findJoinPath(String from, String target, Map<String, List<String>> graph,
                                                Set<String> visited) {
        if (from.equals(target)) {
            return new ArrayList<>();
        }
        visited.add(from);
        for (String next : graph.getOrDefault(from, List.of())) {
            if (visited.contains(next)) {
                continue;
            }
            List<TableEdge> rest = findJoinPath(next, target, graph, visited);
            if (rest != null) {
                rest.add(0, new TableEdge(from, next));
                return rest;
            }
        }
        return null;
    }

    // ==================== AST assembly ====================

    /**
     * Assembles the SQL AST.
     *
     * @param resolved the resolved query
     * @param ctx context filled by {@link #analyseContext}
     * @param model the semantic model, for join keys
     * @return a flat query, or an outer query over a nested aggregating query
     *         when {@code ctx.requiresCte()} is set
     */
    public SqlQuery plan(ResolvedQuery resolved, QueryContext ctx, SemanticModel model) {
        Objects.requireNonNull(resolved, "resolved query must not be null");
        Objects.requireNonNull(model, "model must not be null");
        if (ctx.getCommonTable() == null) {
            throw new IllegalStateException("No common table chosen; analyse the context first");
        }

        Map<Dimension, String> dimensionAliases = allocateDimensionAliases(resolved, ctx);
        SqlQuery.Builder base = SqlQuery.from(ctx.getCommonTable());

        for (Map.Entry<Dimension, String> entry : dimensionAliases.entrySet()) {
            base.select(entry.getValue(), dimensionExpression(entry.getKey()));
        }

        Set<String> emittedBases = new HashSet<>();
        for (ResolvedMeasure measure : resolved.measures()) {
            if (measure instanceof DirectMeasure direct && direct.measure().isWindowed()) {
                String twin = ctx.getWindowMeasureMap().get(direct.name());
                if (!isUserMeasure(resolved, twin) && emittedBases.add(twin)) {
                    base.select(twin, measureExpression(direct));
                }
            } else {
                base.select(measure.name(), measureExpression(measure));
            }
        }

        base.joins(buildJoins(ctx, model));

        List<Predicate> where = new ArrayList<>();
        for (DimensionFilter filter : resolved.dimensionFilters()) {
            where.add(new Comparison(ColumnReference.of(filter.table(), filter.column()),
                filter.comparator(), filter.value()));
        }
        if (!where.isEmpty()) {
            base.where(And.of(where));
        }

        if (resolved.hasMeasures() || !resolved.measureFilters().isEmpty()) {
            List<Expression> groupBy = new ArrayList<>();
            for (Dimension dimension : dimensionAliases.keySet()) {
                groupBy.add(dimensionExpression(dimension));
            }
            base.groupBy(groupBy);
        }

        List<Predicate> having = new ArrayList<>();
        for (MeasureFilter filter : resolved.measureFilters()) {
            having.add(new Comparison(measureExpression(filter.measure()), filter.comparator(), filter.value()));
        }
        if (!having.isEmpty()) {
            base.having(And.of(having));
        }

        SqlQuery result;
        if (!ctx.requiresCte()) {
            for (ResolvedOrderBy order : resolved.orderBy()) {
                base.orderBy(new SortOrder(flatOrderExpression(order), order.sorting()));
            }
            result = base.limit(resolved.limit()).offset(resolved.offset()).build();
        } else {
            result = planStaged(resolved, ctx, base.build(), dimensionAliases);
        }

        logger.debug("Planned {} query from '{}' with {} join(s)",
            ctx.requiresCte() ? "staged" : "flat", ctx.getCommonTable(), ctx.getJoins().size());
        return result;
    }

    private SqlQuery planStaged(ResolvedQuery resolved, QueryContext ctx, SqlQuery inner,
                                Map<Dimension, String> dimensionAliases) {
        String cte = settings.cteName();
        SqlQuery.Builder outer = SqlQuery.from(inner, cte);

        List<Expression> partitionBy = new ArrayList<>();
        List<Expression> windowOrder = new ArrayList<>();
        for (Map.Entry<Dimension, String> entry : dimensionAliases.entrySet()) {
            ColumnReference ref = ColumnReference.of(cte, entry.getValue());
            outer.select(entry.getValue(), ref);
            (entry.getKey().hasTimeGrain() ? windowOrder : partitionBy).add(ref);
        }

        for (ResolvedMeasure measure : resolved.measures()) {
            if (measure instanceof DirectMeasure direct && direct.measure().isWindowed()) {
                String twin = ctx.getWindowMeasureMap().get(direct.name());
                outer.select(direct.name(), new WindowSpec(ColumnReference.of(cte, twin), partitionBy,
                    windowOrder, direct.measure().window()));
            } else {
                outer.select(measure.name(), ColumnReference.of(cte, measure.name()));
            }
        }

        for (ResolvedOrderBy order : resolved.orderBy()) {
            Expression expression;
            if (order instanceof ResolvedOrderBy.ByDimension byDimension) {
                expression = ColumnReference.of(cte, dimensionAliases.get(byDimension.dimension()));
            } else {
                ResolvedMeasure measure = ((ResolvedOrderBy.ByMeasure) order).measure();
                boolean windowed = measure instanceof DirectMeasure direct && direct.measure().isWindowed();
                expression = windowed
                    ? ColumnReference.alias(measure.name())
                    : ColumnReference.of(cte, measure.name());
            }
            outer.orderBy(new SortOrder(expression, order.sorting()));
        }

        return outer.limit(resolved.limit()).offset(resolved.offset()).build();
    }

    private Map<Dimension, String> allocateDimensionAliases(ResolvedQuery resolved, QueryContext ctx) {
        Set<String> used = new HashSet<>();
        for (ResolvedMeasure measure : resolved.measures()) {
            used.add(measure.name());
        }
        used.addAll(ctx.getUniqueMeasures().values());

        Map<Dimension, String> aliases = new LinkedHashMap<>();
        for (Dimension dimension : resolved.dimensions()) {
            String alias = used.contains(dimension.column())
                ? uniqueName(dimension.table() + "_" + dimension.column(), used)
                : dimension.column();
            used.add(alias);
            aliases.putIfAbsent(dimension, alias);
        }
        for (Dimension dimension : resolved.timeGrainedDimensions()) {
            String alias = uniqueName(
                dimension.timeGrain().name().toLowerCase(Locale.ROOT) + "_" + dimension.column(), used);
            used.add(alias);
            aliases.putIfAbsent(dimension, alias);
        }
        return aliases;
    }

    private List<SqlJoin> buildJoins(QueryContext ctx, SemanticModel model) {
        List<SqlJoin> joins = new ArrayList<>();
        for (TableEdge edge : ctx.getJoins()) {
            Relationship relationship = model.getRelationship(edge.incoming(), edge.outgoing())
                .orElseThrow(() -> new IllegalStateException("No relationship for join edge " + edge));
            List<Predicate> keys = new ArrayList<>();
            for (int i = 0; i < relationship.incomingKeys().size(); i++) {
                keys.add(new ColumnComparison(
                    ColumnReference.of(relationship.incoming(), relationship.incomingKeys().get(i)),
                    Comparator.EQUAL,
                    ColumnReference.of(relationship.outgoing(), relationship.outgoingKeys().get(i))));
            }
            joins.add(new SqlJoin(JoinType.LEFT, relationship.incoming(), And.of(keys)));
        }
        return joins;
    }

    private static Expression flatOrderExpression(ResolvedOrderBy order) {
        if (order instanceof ResolvedOrderBy.ByDimension byDimension) {
            return dimensionExpression(byDimension.dimension());
        }
        return measureExpression(((ResolvedOrderBy.ByMeasure) order).measure());
    }

    private static Expression dimensionExpression(Dimension dimension) {
        return dimension.hasTimeGrain()
            ? new TimeGrainColumn(dimension.table(), dimension.column(), dimension.timeGrain())
            : ColumnReference.of(dimension.table(), dimension.column());
    }

    private static Expression measureExpression(ResolvedMeasure measure) {
        if (measure instanceof DerivedMeasure derived) {
            return derived.expression();
        }
        Measure direct = ((DirectMeasure) measure).measure();
        MeasureKey key = direct.key();
        return new AggregateMeasure(key.table(), key.column(), key.aggregation());
    }

    private static boolean isUserMeasure(ResolvedQuery resolved, String name) {
        for (ResolvedMeasure measure : resolved.measures()) {
            if (measure.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static String uniqueName(String candidate, Set<String> used) {
        String name = candidate;
        int suffix = 2;
        while (used.contains(name)) {
            name = candidate + "_" + suffix++;
        }
        return name;
    }
}
