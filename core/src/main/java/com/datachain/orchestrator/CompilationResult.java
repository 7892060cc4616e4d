package com.datachain.orchestrator;

import com.datachain.logical.SqlQuery;
import com.datachain.query.QueryContext;
import com.datachain.validation.QueryError;

import java.util.List;

/**
 * Outcome of compiling one query.
 *
 * <p>On success {@code sql} and {@code ast} are set and {@code errors} is
 * empty. On failure {@code errors} lists every problem found by the first
 * failing stage and no SQL is returned. The context is always present for
 * its trace and warnings.
 *
 * @param sql generated SQL, null on failure
 * @param ast SQL AST, null on failure
 * @param errors errors of the failing stage, empty on success
 * @param context the query's planning context
 */
public record CompilationResult(String sql, SqlQuery ast, List<QueryError> errors, QueryContext context) {

    public CompilationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static CompilationResult success(String sql, SqlQuery ast, QueryContext context) {
        return new CompilationResult(sql, ast, List.of(), context);
    }

    public static CompilationResult failure(List<QueryError> errors, QueryContext context) {
        return new CompilationResult(null, null, errors, context);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public List<String> trace() {
        return context.getTrace();
    }

    public List<String> warnings() {
        return context.getWarnings();
    }
}
