package org.saiql.engine.plan;

import java.util.List;
import java.util.Objects;

public record ProjectNode(RelationNode source, List<Projection> projections, boolean distinct) implements RelationNode {

    public ProjectNode {
        Objects.requireNonNull(source, "Source cannot be null");
        projections = List.copyOf(projections);
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("Projection requires at least one column");
        }
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
