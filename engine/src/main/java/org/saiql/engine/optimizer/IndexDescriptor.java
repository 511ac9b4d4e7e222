package org.saiql.engine.optimizer;

import java.util.List;
import java.util.Objects;

/**
 * An index available on a table.
 *
 * @param name    index name
 * @param columns indexed columns, leading column first
 * @param kind    index structure
 */
public record IndexDescriptor(String name, List<String> columns, IndexKind kind) {

    public IndexDescriptor {
        Objects.requireNonNull(name, "Index name cannot be null");
        Objects.requireNonNull(kind, "Index kind cannot be null");
        columns = List.copyOf(columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Index " + name + " has no columns");
        }
    }

    public static IndexDescriptor btree(String name, String... columns) {
        return new IndexDescriptor(name, List.of(columns), IndexKind.BTREE);
    }

    public static IndexDescriptor hash(String name, String... columns) {
        return new IndexDescriptor(name, List.of(columns), IndexKind.HASH);
    }

    public String leadingColumn() {
        return columns.get(0);
    }
}
