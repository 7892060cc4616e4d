package com.datachain.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DuckDB runtime - owns a single DuckDB connection that compiled queries run on.
 *
 * <p>The runtime is a collaborator of the compiler: it knows nothing about
 * semantic models and only executes SQL text.
 *
 * <p>Typical usage:
 * <pre>{@code
 * try (DuckDBRuntime runtime = DuckDBRuntime.create()) {
 *     QueryExecutor executor = new QueryExecutor(runtime);
 *     ResultTable rows = executor.executeQuery(result.sql());
 * }
 * }</pre>
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create("jdbc:duckdb::memory:test_" + System.nanoTime());
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    /** System property overriding the JDBC URL used by {@link #create()} */
    public static final String PROP_JDBC_URL = "datachain.duckdb.url";

    /** Default JDBC URL for named in-memory database */
    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb::memory:datachain";

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private volatile boolean closed = false;

    /**
     * Private constructor - use create() factory method.
     *
     * @param jdbcUrl JDBC URL for DuckDB connection
     * @throws SQLException if connection fails
     */
    private DuckDBRuntime(String jdbcUrl) throws SQLException {
        this.jdbcUrl = jdbcUrl;

        logger.info("Creating DuckDB runtime with URL: {}", jdbcUrl);

        Connection rawConn = DriverManager.getConnection(jdbcUrl);
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        configureConnection();

        logger.info("DuckDB runtime initialized");
    }

    /**
     * Configure the connection so query results are reproducible.
     */
    private void configureConnection() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("SET enable_progress_bar=false");
            stmt.execute("SET preserve_insertion_order=true");
            stmt.execute("SET default_null_order='nulls_last'");
            logger.debug("DuckDB connection configured");
        }
    }

    /**
     * Create a runtime using {@value #PROP_JDBC_URL} if set, otherwise the
     * default in-memory database.
     *
     * @return new DuckDBRuntime instance
     * @throws RuntimeException if connection fails
     */
    public static DuckDBRuntime create() {
        return create(System.getProperty(PROP_JDBC_URL, DEFAULT_JDBC_URL));
    }

    /**
     * Create a new DuckDBRuntime with custom JDBC URL.
     *
     * @param jdbcUrl JDBC URL (e.g., "jdbc:duckdb::memory:session123")
     * @return new DuckDBRuntime instance
     * @throws RuntimeException if connection fails
     */
    public static DuckDBRuntime create(String jdbcUrl) {
        try {
            return new DuckDBRuntime(jdbcUrl);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create DuckDB runtime: " + jdbcUrl, e);
        }
    }

    /**
     * Create a runtime over an on-disk database file, created if missing.
     *
     * @param dbPath path to the DuckDB database file
     * @return new DuckDBRuntime instance
     * @throws RuntimeException if connection fails
     */
    public static DuckDBRuntime createPersistent(String dbPath) {
        logger.info("Creating persistent DuckDB runtime at: {}", dbPath);
        return create("jdbc:duckdb:" + dbPath);
    }

    /**
     * Get the underlying DuckDB connection.
     *
     * <p>The connection is managed by the runtime - callers should NOT close it.
     *
     * @return the DuckDB connection
     * @throws IllegalStateException if runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the runtime and release resources.
     *
     * <p>After closing, the runtime cannot be used.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        logger.info("Closing DuckDB runtime: {}", jdbcUrl);
        try {
            connection.close();
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection", e);
        }
    }
}
