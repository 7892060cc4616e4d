package com.datachain.semantic;

import com.datachain.exception.DuplicateEntityException;
import com.datachain.exception.MissingEntityException;
import com.datachain.exception.SemanticModelException;
import com.datachain.types.Comparator;
import com.datachain.types.DataType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Registry of tables, relationships, KPIs and named filters that queries are
 * compiled against.
 *
 * <p>The model validates itself on construction and is immutable afterwards,
 * so one instance can be shared by every concurrently compiled query.
 * Construction checks:
 * <ul>
 *   <li>table and column names are unique</li>
 *   <li>every relationship endpoint and join key exists, and key lists pair up</li>
 *   <li>the directed relationship graph has no cycle</li>
 *   <li>the undirected relationship graph is connected</li>
 *   <li>KPIs and filters reference existing columns and KPIs, and derived KPIs
 *       do not depend on themselves</li>
 *   <li>filter values fit their comparator (none, one value or a list)</li>
 * </ul>
 *
 * <p>Every violation is collected and reported in a single
 * {@link SemanticModelException}.
 *
 * <p>Example usage:
 * <pre>
 *   SemanticModel model = SemanticModel.builder()
 *       .table(Table.of("customers", Column.of("id", DataType.NUMERIC)))
 *       .table(Table.of("orders", Column.of("customer_id", DataType.NUMERIC)))
 *       .relationship(Relationship.oneToMany("customers", "id", "orders", "customer_id"))
 *       .build();
 * </pre>
 */
public final class SemanticModel {

    private static final Logger logger = LoggerFactory.getLogger(SemanticModel.class);

    private final List<Table> tables;
    private final Map<String, Table> tablesByName;
    private final List<Relationship> relationships;
    private final List<Kpi> kpis;
    private final List<SemanticFilter> filters;
    private final Map<String, List<String>> directedGraph;
    private final Map<String, List<String>> undirectedGraph;

    /**
     * Creates and validates a semantic model.
     *
     * @param tables declared tables
     * @param relationships declared relationships, may be null
     * @param kpis declared KPIs, may be null
     * @param filters declared filters, may be null
     * @throws SemanticModelException if any structural check fails
     */
    @JsonCreator
    public SemanticModel(@JsonProperty("tables") List<Table> tables,
                         @JsonProperty("relationships") List<Relationship> relationships,
                         @JsonProperty("kpis") List<Kpi> kpis,
                         @JsonProperty("filters") List<SemanticFilter> filters) {
        this.tables = tables == null ? List.of() : List.copyOf(tables);
        this.relationships = relationships == null ? List.of() : List.copyOf(relationships);
        this.kpis = kpis == null ? List.of() : List.copyOf(kpis);
        this.filters = filters == null ? List.of() : List.copyOf(filters);

        List<String> violations = new ArrayList<>();
        this.tablesByName = indexTables(violations);
        validateRelationships(violations);
        this.directedGraph = buildGraph(true);
        this.undirectedGraph = buildGraph(false);
        detectCycle(violations);
        checkConnectivity(violations);
        validateKpis(violations);
        validateFilters(violations);

        if (!violations.isEmpty()) {
            logger.debug("Semantic model rejected with {} violations", violations.size());
            throw new SemanticModelException(violations);
        }

        logger.info("Semantic model built: {} tables, {} relationships, {} KPIs, {} filters",
            this.tables.size(), this.relationships.size(), this.kpis.size(), this.filters.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Accessors ====================

    public List<Table> tables() {
        return tables;
    }

    public List<Relationship> relationships() {
        return relationships;
    }

    public List<Kpi> kpis() {
        return kpis;
    }

    public List<SemanticFilter> filters() {
        return filters;
    }

    public Optional<Table> getTable(String name) {
        return Optional.ofNullable(tablesByName.get(name));
    }

    public boolean fieldExists(String table, String column) {
        return columnType(table, column).isPresent();
    }

    public Optional<DataType> columnType(String table, String column) {
        Table t = tablesByName.get(table);
        if (t == null) {
            return Optional.empty();
        }
        return t.column(column).map(Column::type);
    }

    /**
     * Looks up a KPI by name.
     *
     * @param name KPI name
     * @return the single matching KPI
     * @throws MissingEntityException if no KPI has that name
     * @throws DuplicateEntityException if more than one KPI has that name
     */
    public Kpi getKpi(String name) {
        return getEntity("kpi", kpis, Kpi::name, name);
    }

    /**
     * Looks up a named filter.
     *
     * @param name filter name
     * @return the single matching filter
     * @throws MissingEntityException if no filter has that name
     * @throws DuplicateEntityException if more than one filter has that name
     */
    public SemanticFilter getFilter(String name) {
        return getEntity("filter", filters, SemanticFilter::name, name);
    }

    /**
     * Returns the relationship declared for a directed table pair.
     */
    public Optional<Relationship> getRelationship(String incoming, String outgoing) {
        for (Relationship relationship : relationships) {
            if (relationship.incoming().equals(incoming) && relationship.outgoing().equals(outgoing)) {
                return Optional.of(relationship);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the relationship graph as an adjacency map.
     *
     * <p>Every table is a key, including tables with no relationships.
     * Neighbour lists follow relationship declaration order.
     *
     * @param directed true for {@code incoming -> outgoing} edges only, false to
     *                 add the reverse of every edge
     * @return unmodifiable adjacency map
     */
    public Map<String, List<String>> getRelationshipGraph(boolean directed) {
        return directed ? directedGraph : undirectedGraph;
    }

    private static <T> T getEntity(String kind, List<T> entities, Function<T, String> nameOf, String name) {
        List<T> matches = new ArrayList<>();
        for (T entity : entities) {
            if (nameOf.apply(entity).equals(name)) {
                matches.add(entity);
            }
        }
        if (matches.isEmpty()) {
            throw new MissingEntityException(kind, name);
        }
        if (matches.size() > 1) {
            throw new DuplicateEntityException(kind, name, matches.size());
        }
        return matches.get(0);
    }

    // ==================== Construction checks ====================

    private Map<String, Table> indexTables(List<String> violations) {
        if (tables.isEmpty()) {
            violations.add("Semantic model must declare at least one table");
        }
        Map<String, Table> index = new LinkedHashMap<>();
        for (Table table : tables) {
            if (index.putIfAbsent(table.name(), table) != null) {
                violations.add("Duplicate table '" + table.name() + "'");
            }
            Set<String> columnNames = new HashSet<>();
            for (Column column : table.columns()) {
                if (!columnNames.add(column.name())) {
                    violations.add("Duplicate column '" + column.name() + "' in table '" + table.name() + "'");
                }
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private void validateRelationships(List<String> violations) {
        Set<TableEdge> seen = new HashSet<>();
        for (Relationship rel : relationships) {
            String label = "Relationship " + rel.incoming() + " -> " + rel.outgoing();
            if (rel.type() == RelationshipType.MANY_TO_MANY) {
                violations.add(label + ": MANY_TO_MANY relationships are not supported");
            }
            if (!seen.add(rel.edge())) {
                violations.add(label + ": declared more than once");
            }
            if (rel.incomingKeys().isEmpty() || rel.outgoingKeys().isEmpty()) {
                violations.add(label + ": join keys must not be empty");
            } else if (rel.incomingKeys().size() != rel.outgoingKeys().size()) {
                violations.add(label + ": " + rel.incomingKeys().size() + " incoming keys but "
                    + rel.outgoingKeys().size() + " outgoing keys");
            }
            checkEndpoint(label, rel.incoming(), rel.incomingKeys(), violations);
            checkEndpoint(label, rel.outgoing(), rel.outgoingKeys(), violations);
        }
    }

    private void checkEndpoint(String label, String tableName, List<String> keys, List<String> violations) {
        Table table = tablesByName.get(tableName);
        if (table == null) {
            violations.add(label + ": unknown table '" + tableName + "'");
            return;
        }
        for (String key : keys) {
            if (!table.hasColumn(key)) {
                violations.add(label + ": unknown key column '" + tableName + "." + key + "'");
            }
        }
    }

    private Map<String, List<String>> buildGraph(boolean directed) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (String table : tablesByName.keySet()) {
            adjacency.put(table, new LinkedHashSet<>());
        }
        for (Relationship rel : relationships) {
            // edges to undeclared tables were already reported
            if (!adjacency.containsKey(rel.incoming()) || !adjacency.containsKey(rel.outgoing())) {
                continue;
            }
            adjacency.get(rel.incoming()).add(rel.outgoing());
            if (!directed) {
                adjacency.get(rel.outgoing()).add(rel.incoming());
            }
        }
        Map<String, List<String>> graph = new LinkedHashMap<>();
        adjacency.forEach((table, neighbours) -> graph.put(table, List.copyOf(neighbours)));
        return Collections.unmodifiableMap(graph);
    }

    /**
     * Depth-first search with an explicit stack; the first back edge found is
     * reported against the table where the cycle closes.
     */
    private void detectCycle(List<String> violations) {
        Set<String> finished = new HashSet<>();
        for (String root : directedGraph.keySet()) {
            if (finished.contains(root)) {
                continue;
            }
            List<String> path = findCycleFrom(root, directedGraph, finished);
            if (path != null) {
                violations.add("Relationship cycle detected at table '" + path.get(path.size() - 1)
                    + "': " + String.join(" -> ", path));
                return;
            }
        }
    }

    /**
     * Iterative DFS from {@code root}. Returns the cycle path ending at the
     * closing node, or null when no back edge is reachable.
     */
    private static List<String> findCycleFrom(String root, Map<String, List<String>> graph, Set<String> finished) {
        Deque<String> pathStack = new ArrayDeque<>();
        Deque<Integer> nextChild = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();

        pathStack.push(root);
        nextChild.push(0);
        onPath.add(root);

        while (!pathStack.isEmpty()) {
            String node = pathStack.peek();
            int index = nextChild.pop();
            List<String> neighbours = graph.getOrDefault(node, List.of());

            if (index >= neighbours.size()) {
                pathStack.pop();
                onPath.remove(node);
                finished.add(node);
                continue;
            }
            nextChild.push(index + 1);

            String next = neighbours.get(index);
            if (onPath.contains(next)) {
                List<String> path = new ArrayList<>(pathStack);
                Collections.reverse(path);
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (!finished.contains(next)) {
                pathStack.push(next);
                nextChild.push(0);
                onPath.add(next);
            }
        }
        return null;
    }

    private void checkConnectivity(List<String> violations) {
        if (undirectedGraph.size() < 2) {
            return;
        }
        String start = undirectedGraph.keySet().iterator().next();
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        visited.add(start);
        while (!queue.isEmpty()) {
            for (String neighbour : undirectedGraph.get(queue.poll())) {
                if (visited.add(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        if (visited.size() < undirectedGraph.size()) {
            List<String> unreachable = new ArrayList<>();
            for (String table : undirectedGraph.keySet()) {
                if (!visited.contains(table)) {
                    unreachable.add(table);
                }
            }
            violations.add("Relationship graph is not connected: " + unreachable
                + " unreachable from '" + start + "'");
        }
    }

    private void validateKpis(List<String> violations) {
        Set<String> kpiNames = new HashSet<>();
        for (Kpi kpi : kpis) {
            kpiNames.add(kpi.name());
        }
        Map<String, List<String>> dependencies = new HashMap<>();
        for (Kpi kpi : kpis) {
            KpiExpression expression = kpi.expression();
            if (expression instanceof KpiMetric metric) {
                if (!fieldExists(metric.table(), metric.column())) {
                    violations.add("KPI '" + kpi.name() + "' references unknown column '"
                        + metric.table() + "." + metric.column() + "'");
                }
            } else if (expression instanceof KpiBinary binary) {
                for (String operand : List.of(binary.left(), binary.right())) {
                    if (!kpiNames.contains(operand)) {
                        violations.add("KPI '" + kpi.name() + "' references unknown KPI '" + operand + "'");
                    }
                }
                dependencies.computeIfAbsent(kpi.name(), k -> new ArrayList<>())
                    .addAll(List.of(binary.left(), binary.right()));
            }
        }

        Set<String> finished = new HashSet<>();
        for (String name : dependencies.keySet()) {
            if (finished.contains(name)) {
                continue;
            }
            List<String> cycle = findCycleFrom(name, dependencies, finished);
            if (cycle != null) {
                violations.add("KPI dependency cycle detected at '" + cycle.get(cycle.size() - 1)
                    + "': " + String.join(" -> ", cycle));
                return;
            }
        }
    }

    private void validateFilters(List<String> violations) {
        Set<String> kpiNames = new HashSet<>();
        for (Kpi kpi : kpis) {
            kpiNames.add(kpi.name());
        }
        for (SemanticFilter filter : filters) {
            SemanticPredicate predicate = filter.predicate();
            if (predicate instanceof SemanticComparison comparison) {
                if (!fieldExists(comparison.table(), comparison.column())) {
                    violations.add("Filter '" + filter.name() + "' references unknown column '"
                        + comparison.table() + "." + comparison.column() + "'");
                }
                checkFilterValue(filter.name(), comparison.comparator(), comparison.value(), violations);
            } else if (predicate instanceof KpiComparison comparison) {
                if (!kpiNames.contains(comparison.kpi())) {
                    violations.add("Filter '" + filter.name() + "' references unknown KPI '"
                        + comparison.kpi() + "'");
                }
                checkFilterValue(filter.name(), comparison.comparator(), comparison.value(), violations);
            }
        }
    }

    /**
     * Null checks take no value, IN and NOT IN take a non-empty list, every
     * other comparator takes a single non-null value.
     */
    private static void checkFilterValue(String name, Comparator comparator, Object value,
                                         List<String> violations) {
        String label = "Filter '" + name + "' (" + comparator.symbol() + ")";
        if (comparator.isNullCheck()) {
            if (value != null) {
                violations.add(label + " takes no value");
            }
        } else if (value == null) {
            violations.add(label + " requires a value");
        } else if (comparator.isMembership()) {
            if (!(value instanceof Collection<?> values) || values.isEmpty()) {
                violations.add(label + " requires a non-empty list of values");
            }
        } else if (value instanceof Collection<?>) {
            violations.add(label + " requires a single value, got a list");
        }
    }

    @Override
    public String toString() {
        return "SemanticModel(tables=" + tablesByName.keySet()
            + ", relationships=" + relationships.size()
            + ", kpis=" + kpis.size()
            + ", filters=" + filters.size() + ")";
    }

    /**
     * Fluent builder for assembling a model in code.
     */
    public static final class Builder {
        private final List<Table> tables = new ArrayList<>();
        private final List<Relationship> relationships = new ArrayList<>();
        private final List<Kpi> kpis = new ArrayList<>();
        private final List<SemanticFilter> filters = new ArrayList<>();

        private Builder() {
        }

        public Builder table(Table table) {
            tables.add(table);
            return this;
        }

        public Builder relationship(Relationship relationship) {
            relationships.add(relationship);
            return this;
        }

        public Builder kpi(Kpi kpi) {
            kpis.add(kpi);
            return this;
        }

        public Builder filter(SemanticFilter filter) {
            filters.add(filter);
            return this;
        }

        /**
         * Builds and validates the model.
         *
         * @throws SemanticModelException if any structural check fails
         */
        public SemanticModel build() {
            return new SemanticModel(tables, relationships, kpis, filters);
        }
    }
}
