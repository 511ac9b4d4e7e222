package org.saiql.engine.plan;

import org.saiql.engine.store.Table;

import java.util.Objects;

/**
 * Represents a DELETE statement.
 *
 * @param table       The target table
 * @param whereClause Filter for rows to delete, or null for every row
 */
public record DeleteNode(Table table, Expression whereClause) implements MutationNode {

    public DeleteNode {
        Objects.requireNonNull(table, "Table cannot be null");
    }

    @Override
    public <T> T accept(MutationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
