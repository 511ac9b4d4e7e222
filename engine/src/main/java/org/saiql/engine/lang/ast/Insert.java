package org.saiql.engine.lang.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code INSERT INTO table [(columns)] VALUES (...), ...}.
 *
 * @param table   target table
 * @param columns explicit column list, empty for all columns in table order
 * @param rows    value rows
 */
public record Insert(String table, List<String> columns, List<List<ExprAst>> rows) implements QueryAst {

    public Insert {
        Objects.requireNonNull(table, "Table cannot be null");
        columns = List.copyOf(columns);
        rows = rows.stream().map(List::copyOf).toList();
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("INSERT requires at least one row");
        }
    }

    @Override
    public <T> T accept(QueryAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
