package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * A literal exactly as written; conversion to a typed value happens in the
 * validator.
 */
public record Literal(Kind kind, String text) implements ExprAst {

    public enum Kind {
        STRING, INTEGER, DECIMAL, BOOLEAN, NULL
    }

    public Literal {
        Objects.requireNonNull(kind, "Literal kind cannot be null");
        Objects.requireNonNull(text, "Literal text cannot be null");
    }

    public static Literal string(String value) {
        return new Literal(Kind.STRING, value);
    }

    public static Literal integer(long value) {
        return new Literal(Kind.INTEGER, Long.toString(value));
    }

    public static Literal nullValue() {
        return new Literal(Kind.NULL, "NULL");
    }

    @Override
    public <T> T accept(ExprAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
