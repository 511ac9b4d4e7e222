package org.saiql.engine;

import java.util.Objects;

/**
 * Base exception for every abort in the compilation pipeline.
 *
 * <p>Stages raise a subclass describing where the failure happened; all of
 * them carry an {@link ErrorCode}.
 */
public class QueryCompileException extends RuntimeException {

    private final ErrorCode errorCode;

    public QueryCompileException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public QueryCompileException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
