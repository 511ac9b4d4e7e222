package org.saiql.engine.store;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A catalog table: columns in declaration order, primary key and foreign keys.
 *
 * @param name        The table name
 * @param columns     Immutable list of columns
 * @param primaryKey  Primary key column names, possibly empty
 * @param foreignKeys Declared foreign keys, possibly empty
 */
public record Table(String name, List<Column> columns, List<String> primaryKey, List<ForeignKey> foreignKeys) {

    public Table {
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }
        columns = List.copyOf(columns);
        primaryKey = List.copyOf(primaryKey);
        foreignKeys = List.copyOf(foreignKeys);

        Set<String> seen = new HashSet<>();
        for (Column column : columns) {
            if (!seen.add(column.name().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Duplicate column '" + column.name() + "' in table " + name);
            }
        }
        for (String key : primaryKey) {
            if (!seen.contains(key.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("Primary key column '" + key + "' not in table " + name);
            }
        }
    }

    public Table(String name, List<Column> columns) {
        this(name, columns, List.of(), List.of());
    }

    /**
     * Finds a column by name, ignoring case.
     */
    public Optional<Column> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equalsIgnoreCase(columnName))
                .findFirst();
    }

    /**
     * @throws IllegalArgumentException if the column does not exist
     */
    public Column getColumn(String columnName) {
        return findColumn(columnName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Column '" + columnName + "' not found in table " + name));
    }

    public Table withPrimaryKey(String... columnNames) {
        return new Table(name, columns, List.of(columnNames), foreignKeys);
    }

    public Table withForeignKey(ForeignKey foreignKey) {
        List<ForeignKey> keys = new ArrayList<>(foreignKeys);
        keys.add(foreignKey);
        return new Table(name, columns, primaryKey, keys);
    }
}
