package org.saiql.engine.types;

import org.saiql.engine.DialectId;
import org.saiql.engine.ErrorCode;
import org.saiql.engine.QueryCompileException;

/**
 * Exception thrown when a type has no representation on one side of a mapping.
 */
public class TypeMappingException extends QueryCompileException {

    private final DialectId dialect;
    private final String type;

    public TypeMappingException(DialectId dialect, String type, String message) {
        super(ErrorCode.UNSUPPORTED_TYPE, message);
        this.dialect = dialect;
        this.type = type;
    }

    public DialectId dialect() {
        return dialect;
    }

    /**
     * The offending signature or canonical type.
     */
    public String type() {
        return type;
    }
}
