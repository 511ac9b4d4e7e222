package org.saiql.engine.store;

import java.util.List;
import java.util.Objects;

/**
 * A declared foreign key, used to derive join conditions the query leaves out.
 *
 * @param columns           referencing columns of the owning table
 * @param referencedTable   referenced table
 * @param referencedColumns referenced columns, positionally matching {@code columns}
 */
public record ForeignKey(List<String> columns, String referencedTable, List<String> referencedColumns) {

    public ForeignKey {
        columns = List.copyOf(columns);
        Objects.requireNonNull(referencedTable, "Referenced table cannot be null");
        referencedColumns = List.copyOf(referencedColumns);
        if (columns.isEmpty() || columns.size() != referencedColumns.size()) {
            throw new IllegalArgumentException("Foreign key needs matching, non-empty column lists");
        }
    }

    public static ForeignKey of(String column, String referencedTable, String referencedColumn) {
        return new ForeignKey(List.of(column), referencedTable, List.of(referencedColumn));
    }
}
