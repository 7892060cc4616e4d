package com.datachain.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A single user-facing problem with a submitted query.
 *
 * <p>Errors are accumulated within a stage so a caller can fix several issues
 * in one round trip.
 *
 * @param stage the stage that found the problem
 * @param code stable error code
 * @param message human-readable description
 * @param hint optional suggestion for fixing the query, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryError(ErrorStage stage, ErrorCode code, String message, String hint) {

    public QueryError {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static QueryError of(ErrorStage stage, ErrorCode code, String message) {
        return new QueryError(stage, code, message, null);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(stage).append('/').append(code).append("] ").append(message);
        if (hint != null) {
            sb.append(" (hint: ").append(hint).append(')');
        }
        return sb.toString();
    }
}
