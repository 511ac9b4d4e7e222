package org.saiql.engine.plan;

import org.saiql.engine.store.Column;
import org.saiql.engine.store.Table;

import java.util.List;
import java.util.Objects;

/**
 * Represents an UPDATE statement.
 *
 * @param table       The target table
 * @param assignments Column/value pairs in statement order
 * @param whereClause Filter for rows to update, or null for every row
 */
public record UpdateNode(Table table, List<Assignment> assignments, Expression whereClause) implements MutationNode {

    public record Assignment(Column column, Literal value) {
        public Assignment {
            Objects.requireNonNull(column, "Column cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }
    }

    public UpdateNode {
        Objects.requireNonNull(table, "Table cannot be null");
        assignments = List.copyOf(assignments);
        if (assignments.isEmpty()) {
            throw new IllegalArgumentException("UPDATE requires at least one assignment");
        }
    }

    @Override
    public <T> T accept(MutationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
