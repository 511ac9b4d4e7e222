package org.saiql.engine.lang.ast;

import java.util.List;
import java.util.Objects;

/**
 * The column list of a projection. A {@code *} entry (bare or qualified)
 * is expanded by the validator.
 */
public record ColumnList(List<Item> items) {

    /**
     * @param alias output name, or null
     */
    public record Item(ColumnRef column, String alias) implements SelectItem {
        public Item {
            Objects.requireNonNull(column, "Column cannot be null");
        }
    }

    public ColumnList {
        items = List.copyOf(items);
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Column list cannot be empty");
        }
    }

    public static ColumnList wildcard() {
        return new ColumnList(List.of(new Item(ColumnRef.wildcard(null), null)));
    }

    public static ColumnList of(List<ColumnRef> columns) {
        return new ColumnList(columns.stream().map(c -> new Item(c, null)).toList());
    }
}
