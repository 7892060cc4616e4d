package com.datachain.query;

import com.datachain.semantic.TableEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable planning state for one query compilation.
 *
 * <p>Created by the orchestrator, filled in stage by stage (the resolver adds
 * tables, join-path validation picks the common table, the planner records
 * joins and window bookkeeping) and discarded afterwards. Never shared
 * between queries.
 */
public class QueryContext {

    private static final Logger logger = LoggerFactory.getLogger(QueryContext.class);

    private final Set<String> tables = new LinkedHashSet<>();
    private final List<TableEdge> joins = new ArrayList<>();
    private final Map<MeasureKey, String> uniqueMeasures = new LinkedHashMap<>();
    private final List<Measure> windowMeasures = new ArrayList<>();
    private final Map<String, String> windowMeasureMap = new LinkedHashMap<>();
    private final List<String> trace = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private String commonTable;
    private boolean requiresCte;

    public Set<String> getTables() {
        return Collections.unmodifiableSet(tables);
    }

    public void addTable(String table) {
        tables.add(table);
    }

    public String getCommonTable() {
        return commonTable;
    }

    public void setCommonTable(String commonTable) {
        this.commonTable = commonTable;
    }

    public List<TableEdge> getJoins() {
        return Collections.unmodifiableList(joins);
    }

    /**
     * Appends a join edge unless it is already present.
     *
     * @return true if the edge was added
     */
    public boolean addJoin(TableEdge edge) {
        if (joins.contains(edge)) {
            return false;
        }
        joins.add(edge);
        return true;
    }

    public boolean requiresCte() {
        return requiresCte;
    }

    public void setRequiresCte(boolean requiresCte) {
        this.requiresCte = requiresCte;
    }

    /**
     * Returns the inner-query alias computing each distinct aggregate.
     */
    public Map<MeasureKey, String> getUniqueMeasures() {
        return Collections.unmodifiableMap(uniqueMeasures);
    }

    public void putUniqueMeasure(MeasureKey key, String alias) {
        uniqueMeasures.putIfAbsent(key, alias);
    }

    public List<Measure> getWindowMeasures() {
        return Collections.unmodifiableList(windowMeasures);
    }

    public void addWindowMeasure(Measure measure) {
        windowMeasures.add(measure);
    }

    /**
     * Returns, for each windowed measure name, the alias of the aggregate its
     * window reads.
     */
    public Map<String, String> getWindowMeasureMap() {
        return Collections.unmodifiableMap(windowMeasureMap);
    }

    public void mapWindowMeasure(String windowedName, String twinAlias) {
        windowMeasureMap.put(windowedName, twinAlias);
    }

    public List<String> getTrace() {
        return Collections.unmodifiableList(trace);
    }

    public void trace(String message) {
        trace.add(message);
        logger.debug("trace: {}", message);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void warn(String message) {
        warnings.add(message);
        logger.warn(message);
    }

    @Override
    public String toString() {
        return "QueryContext(tables=" + tables
            + ", commonTable=" + commonTable
            + ", joins=" + joins
            + ", requiresCte=" + requiresCte + ")";
    }
}
