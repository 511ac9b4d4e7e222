package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * Row filter. The condition is evaluated against the rows of the source
 * relation before any projection or aggregation above it.
 */
public record Filter(ExprAst condition, RelationAst source) implements RelationAst {

    public Filter {
        Objects.requireNonNull(condition, "Condition cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
    }

    @Override
    public <T> T accept(RelationAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
