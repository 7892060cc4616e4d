package com.datachain.runtime;

import com.datachain.exception.QueryExecutionException;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes SQL on a {@link DuckDBRuntime}.
 *
 * <p>Compiled queries go through {@link #executeQuery}; table setup (DDL,
 * inserts) goes through {@link #executeUpdate}. Every SQLException is wrapped
 * in a {@link QueryExecutionException} carrying the failed statement.
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final DuckDBRuntime runtime;

    /**
     * Creates a query executor with the specified runtime.
     *
     * @param runtime the DuckDB runtime
     */
    public QueryExecutor(DuckDBRuntime runtime) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
    }

    /**
     * Executes a query and materializes every row.
     *
     * @param sql the SQL query to execute
     * @return the result rows with their column labels
     * @throws QueryExecutionException if query execution fails
     * @throws NullPointerException if sql is null
     */
    public ResultTable executeQuery(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");

        DuckDBConnection conn = runtime.getConnection();
        long start = System.nanoTime();

        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {

            ResultSetMetaData meta = rs.getMetaData();
            List<String> columns = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                columns.add(meta.getColumnLabel(i));
            }

            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                List<Object> row = new ArrayList<>(columns.size());
                for (int i = 1; i <= columns.size(); i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(row);
            }

            logger.debug("Query returned {} rows in {} ms", rows.size(), (System.nanoTime() - start) / 1_000_000);
            return new ResultTable(columns, rows);

        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to execute query: " + e.getMessage(), e, sql);
        }
    }

    /**
     * Executes a statement that does not return rows.
     *
     * @param sql the SQL statement to execute
     * @return the number of rows affected (for DML), or 0 (for DDL)
     * @throws QueryExecutionException if statement execution fails
     * @throws NullPointerException if sql is null
     */
    public int executeUpdate(String sql) {
        Objects.requireNonNull(sql, "sql must not be null");

        try (Statement stmt = runtime.getConnection().createStatement()) {
            return stmt.executeUpdate(sql);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to execute update: " + e.getMessage(), e, sql);
        }
    }

    public DuckDBRuntime getRuntime() {
        return runtime;
    }
}
