package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * A column reference, optionally qualified by a table name or alias.
 * The name {@code *} denotes a wildcard.
 */
public record ColumnRef(String qualifier, String name) implements ExprAst {

    public static final String WILDCARD = "*";

    public ColumnRef {
        Objects.requireNonNull(name, "Column name cannot be null");
    }

    public static ColumnRef of(String name) {
        return new ColumnRef(null, name);
    }

    public static ColumnRef wildcard(String qualifier) {
        return new ColumnRef(qualifier, WILDCARD);
    }

    public boolean isWildcard() {
        return WILDCARD.equals(name);
    }

    @Override
    public String toString() {
        return qualifier == null ? name : qualifier + "." + name;
    }

    @Override
    public <T> T accept(ExprAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
