package org.saiql.engine.plan;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.QueryCompileException;

/**
 * Raised by the validator when a well-formed query does not make sense
 * against the schema.
 */
public class SemanticException extends QueryCompileException {

    public SemanticException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
