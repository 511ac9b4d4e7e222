package org.saiql.engine.lang;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.QueryCompileException;

import java.util.Set;

/**
 * Exception thrown by the parser on the first grammar violation.
 */
public class SyntaxException extends QueryCompileException {

    private final int line;
    private final int column;
    private final Set<String> expected;

    public SyntaxException(String message, Token found, Set<String> expected) {
        super(ErrorCode.SYNTAX_ERROR, message + " at " + found.position()
                + (expected.isEmpty() ? "" : " (expected " + String.join(" or ", expected) + ")"));
        this.line = found.line();
        this.column = found.column();
        this.expected = Set.copyOf(expected);
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /**
     * Token spellings the parser would have accepted at the failure point.
     */
    public Set<String> expected() {
        return expected;
    }
}
