package org.saiql.migration;

import org.saiql.engine.store.ForeignKey;

import java.util.List;
import java.util.Objects;

/**
 * A table as the source database declares it.
 *
 * @param name        The table name
 * @param columns     Columns in declaration order
 * @param primaryKey  Primary key columns in key order, possibly empty
 * @param foreignKeys Declared foreign keys, possibly empty
 */
public record SourceTable(String name, List<SourceColumn> columns, List<String> primaryKey,
                          List<ForeignKey> foreignKeys) {

    public SourceTable {
        Objects.requireNonNull(name, "Table name cannot be null");
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        foreignKeys = List.copyOf(foreignKeys);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " has no columns");
        }
    }

    public SourceTable(String name, List<SourceColumn> columns, List<String> primaryKey) {
        this(name, columns, primaryKey, List.of());
    }
}
