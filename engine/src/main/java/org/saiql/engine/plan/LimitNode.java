package org.saiql.engine.plan;

import java.util.Objects;

/**
 * Represents a LIMIT/OFFSET clause.
 *
 * @param source The source relation
 * @param limit  Maximum number of rows, or null for no limit
 * @param offset Number of rows to skip
 */
public record LimitNode(RelationNode source, Long limit, long offset) implements RelationNode {

    public LimitNode {
        Objects.requireNonNull(source, "Source cannot be null");
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit must be non-negative, got: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be non-negative, got: " + offset);
        }
        if (limit == null && offset == 0) {
            throw new IllegalArgumentException("LimitNode needs a limit or an offset");
        }
    }

    public static LimitNode limit(RelationNode source, long limit) {
        return new LimitNode(source, limit, 0);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
