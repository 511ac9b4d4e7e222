package org.saiql.engine.plan;

import org.saiql.engine.store.Column;
import org.saiql.engine.store.Table;

import java.util.List;
import java.util.Objects;

/**
 * INSERT of literal rows.
 *
 * @param table   target table
 * @param columns target columns in value order
 * @param rows    value rows, each the same width as {@code columns}
 */
public record InsertNode(Table table, List<Column> columns, List<List<Literal>> rows) implements MutationNode {

    public InsertNode {
        Objects.requireNonNull(table, "Table cannot be null");
        columns = List.copyOf(columns);
        rows = rows.stream().map(List::copyOf).toList();
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("INSERT requires at least one row");
        }
        for (List<Literal> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row width " + row.size() + " does not match "
                        + columns.size() + " columns");
            }
        }
    }

    @Override
    public <T> T accept(MutationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
