package org.saiql.engine.lang;

import java.util.Objects;

/**
 * A lexical token with its source position.
 *
 * <p>For {@link TokenType#STRING} and {@link TokenType#QUOTED_IDENTIFIER} the
 * text is the unescaped value; for every other type it is the source
 * spelling.
 *
 * @param type   token kind
 * @param text   token text
 * @param offset character offset of the first character in the query
 * @param line   1-based line
 * @param column 1-based column
 */
public record Token(TokenType type, String text, int offset, int line, int column) {

    public Token {
        Objects.requireNonNull(type, "Token type cannot be null");
        Objects.requireNonNull(text, "Token text cannot be null");
    }

    public boolean is(TokenType other) {
        return type == other;
    }

    /**
     * Canonical spelling used in normalized query text: keywords upper-case,
     * literals re-quoted.
     */
    public String canonicalText() {
        return switch (type) {
            case STRING -> "'" + text.replace("'", "''") + "'";
            case QUOTED_IDENTIFIER -> "\"" + text.replace("\"", "\"\"") + "\"";
            case EOF -> "";
            default -> type.isKeyword() ? type.name() : text;
        };
    }

    public String position() {
        return "line " + line + ", column " + column;
    }

    @Override
    public String toString() {
        return type + "('" + text + "') at " + position();
    }
}
