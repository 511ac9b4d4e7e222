package org.saiql.migration;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.QueryCompileException;

/**
 * Exception thrown when a schema cannot be moved to the target dialect.
 */
public class MigrationException extends QueryCompileException {

    public MigrationException(String message) {
        super(ErrorCode.MIGRATION_ERROR, message);
    }

    public MigrationException(String message, Throwable cause) {
        super(ErrorCode.MIGRATION_ERROR, message, cause);
    }
}
