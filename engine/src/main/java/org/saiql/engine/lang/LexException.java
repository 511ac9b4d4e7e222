package org.saiql.engine.lang;

import org.saiql.engine.ErrorCode;
import org.saiql.engine.QueryCompileException;

/**
 * Exception thrown when the lexer meets a character or literal it cannot
 * tokenize. The offset counts UTF-8 bytes; line and column count characters.
 */
public class LexException extends QueryCompileException {

    private final int offset;
    private final int line;
    private final int column;
    private final char character;

    public LexException(String message, int offset, int line, int column, char character) {
        super(ErrorCode.LEX_ERROR, message + " at line " + line + ", column " + column + " (offset " + offset + ")");
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.character = character;
    }

    /**
     * UTF-8 byte offset of the offending character from the start of the query.
     */
    public int offset() {
        return offset;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    /**
     * The offending character, or {@code '\0'} at end of input.
     */
    public char character() {
        return character;
    }
}
