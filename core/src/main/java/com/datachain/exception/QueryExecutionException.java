package com.datachain.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when compiled SQL fails to execute in DuckDB.
 *
 * <p>Wraps the SQLException with the statement that failed and translates
 * common DuckDB errors into short, actionable messages.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       ResultTable result = executor.executeQuery(sql);
 *   } catch (QueryExecutionException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed SQL: " + e.getFailedSQL());
 *   }
 * </pre>
 *
 * @see com.datachain.runtime.QueryExecutor
 */
public class QueryExecutionException extends RuntimeException {

    private static final Pattern MISSING_COLUMN = Pattern.compile("[Cc]olumn \"([^\"]+)\" not found");
    private static final Pattern MISSING_TABLE = Pattern.compile("Table with name ([^ ]+) does not exist");

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();
        if (message == null) {
            return "Query execution failed. Check that the semantic model matches the database.";
        }

        Matcher column = MISSING_COLUMN.matcher(message);
        if (message.contains("Binder Error") && column.find()) {
            return "Column '" + column.group(1) + "' does not exist in the database. "
                + "Check the semantic model column names.";
        }

        Matcher table = MISSING_TABLE.matcher(message);
        if (message.contains("Catalog Error") && table.find()) {
            return "Table " + table.group(1) + " does not exist in the database. "
                + "Register the table before running queries against it.";
        }

        if (message.contains("Conversion Error")) {
            return "Data type mismatch in query. Check filter values against column types.";
        }

        if (message.contains("Parser Error")) {
            return "Generated SQL could not be parsed: " + message;
        }

        return "Query execution failed: " + message;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with the failed statement
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Query Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");
        if (failedSQL != null) {
            sb.append("SQL: ").append(failedSQL).append("\n");
        }
        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getSimpleName())
                .append(": ").append(getCause().getMessage()).append("\n");
        }
        return sb.toString();
    }
}
