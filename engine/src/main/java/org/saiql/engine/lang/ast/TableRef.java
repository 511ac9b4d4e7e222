package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * A table reference.
 *
 * @param name  table name as written
 * @param alias alias, or null to use the table name
 */
public record TableRef(String name, String alias) implements RelationAst {

    public TableRef {
        Objects.requireNonNull(name, "Table name cannot be null");
    }

    public static TableRef of(String name) {
        return new TableRef(name, null);
    }

    @Override
    public <T> T accept(RelationAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
