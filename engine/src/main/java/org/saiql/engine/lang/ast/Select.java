package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * Projection of a column list over a relation.
 */
public record Select(ColumnList columns, boolean distinct, RelationAst source) implements RelationAst {

    public Select {
        Objects.requireNonNull(columns, "Columns cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
    }

    @Override
    public <T> T accept(RelationAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
