package com.datachain.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Materialized query result: column labels and rows of JDBC values.
 */
public final class ResultTable {

    private final List<String> columns;
    private final List<List<Object>> rows;

    public ResultTable(List<String> columns, List<List<Object>> rows) {
        this.columns = List.copyOf(columns);
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copied);
    }

    public List<String> columns() {
        return columns;
    }

    public List<List<Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * Returns the value of a column in a row, by column label.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public Object get(int row, String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("No column '" + column + "' in " + columns);
        }
        return rows.get(row).get(index);
    }

    /**
     * Returns a numeric value as a double, or null for SQL NULL.
     */
    public Double getDouble(int row, String column) {
        Object value = get(row, column);
        return value == null ? null : ((Number) value).doubleValue();
    }

    @Override
    public String toString() {
        return "ResultTable(columns=" + columns + ", rows=" + rows.size() + ")";
    }
}
