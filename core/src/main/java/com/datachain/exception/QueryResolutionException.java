package com.datachain.exception;

import com.datachain.validation.ErrorCode;
import com.datachain.validation.ErrorStage;
import com.datachain.validation.QueryError;

/**
 * Exception thrown when a reference that passed validation cannot be resolved.
 *
 * <p>This indicates a pipeline defect (the reference validator was bypassed or
 * disagrees with the resolver), not a caller mistake, so it is raised rather
 * than returned as a {@link QueryError}.
 */
public class QueryResolutionException extends RuntimeException {

    private final QueryError error;

    public QueryResolutionException(String message) {
        super(message);
        this.error = QueryError.of(ErrorStage.RESOLUTION, ErrorCode.UNRESOLVED_REFERENCE, message);
    }

    public QueryResolutionException(String message, Throwable cause) {
        super(message, cause);
        this.error = QueryError.of(ErrorStage.RESOLUTION, ErrorCode.UNRESOLVED_REFERENCE, message);
    }

    /**
     * Returns the failure as a resolution-stage error.
     *
     * @return the error describing the unresolved reference
     */
    public QueryError getError() {
        return error;
    }
}
