package org.saiql.engine.plan;

import java.util.Objects;

/**
 * Keeps the source rows for which the condition holds.
 */
public record FilterNode(RelationNode source, Expression condition) implements RelationNode {

    public FilterNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(condition, "Condition cannot be null");
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
