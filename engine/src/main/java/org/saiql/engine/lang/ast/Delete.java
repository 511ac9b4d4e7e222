package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * {@code DELETE FROM table [WHERE condition]}.
 *
 * @param where filter condition, or null to delete every row
 */
public record Delete(String table, ExprAst where) implements QueryAst {

    public Delete {
        Objects.requireNonNull(table, "Table cannot be null");
    }

    @Override
    public <T> T accept(QueryAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
