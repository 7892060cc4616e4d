package com.datachain.exception;

import com.datachain.logical.SqlQuery;

/**
 * Exception thrown when SQL generation fails.
 *
 * <p>Carries the SQL query node that could not be rendered, for debugging.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = generator.generate(query);
 *   } catch (SQLGenerationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println(e.getTechnicalMessage());
 *   }
 * </pre>
 *
 * @see com.datachain.generator.SQLGenerator
 */
public class SQLGenerationException extends RuntimeException {

    private final SqlQuery failedQuery;

    /**
     * Creates a SQL generation exception.
     *
     * @param message the error message
     * @param query the query node that failed to render
     */
    public SQLGenerationException(String message, SqlQuery query) {
        super(message);
        this.failedQuery = query;
    }

    /**
     * Creates a SQL generation exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     * @param query the query node that failed to render
     */
    public SQLGenerationException(String message, Throwable cause, SqlQuery query) {
        super(message, cause);
        this.failedQuery = query;
    }

    /**
     * Returns the query node that failed to render.
     *
     * @return the failed query, or null if not available
     */
    public SqlQuery getFailedQuery() {
        return failedQuery;
    }

    /**
     * Returns a user-friendly error message.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        if (failedQuery != null && failedQuery.source() instanceof SqlQuery.QuerySource) {
            return "Failed to generate SQL for a staged (CTE) query: " + getMessage();
        }
        return "Failed to generate SQL: " + getMessage();
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("SQL Generation Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedQuery != null) {
            sb.append("Query: ").append(failedQuery).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
