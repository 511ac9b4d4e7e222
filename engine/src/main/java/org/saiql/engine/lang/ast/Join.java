package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * A binary join.
 *
 * @param condition explicit join condition, or null to derive it from
 *                  foreign keys (or for a cross join)
 */
public record Join(JoinKind kind, RelationAst left, RelationAst right, ExprAst condition) implements RelationAst {

    public Join {
        Objects.requireNonNull(kind, "Join kind cannot be null");
        Objects.requireNonNull(left, "Left relation cannot be null");
        Objects.requireNonNull(right, "Right relation cannot be null");
    }

    @Override
    public <T> T accept(RelationAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
