package org.saiql.engine.lang.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code UPDATE table SET column = value, ... [WHERE condition]}.
 *
 * @param where filter condition, or null to update every row
 */
public record Update(String table, List<Assignment> assignments, ExprAst where) implements QueryAst {

    public record Assignment(String column, ExprAst value) {
        public Assignment {
            Objects.requireNonNull(column, "Column cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
        }
    }

    public Update {
        Objects.requireNonNull(table, "Table cannot be null");
        assignments = List.copyOf(assignments);
        if (assignments.isEmpty()) {
            throw new IllegalArgumentException("UPDATE requires at least one assignment");
        }
    }

    @Override
    public <T> T accept(QueryAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
