package org.saiql.engine.store;

import org.saiql.engine.types.CanonicalType;

import java.util.Objects;

/**
 * A column of a catalog table.
 *
 * @param name The column name
 * @param type The canonical column type; nullability lives on the type
 */
public record Column(String name, CanonicalType type) {

    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(type, "Column type cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    /**
     * Factory for a non-nullable column.
     */
    public static Column required(String name, CanonicalType type) {
        return new Column(name, type.notNull());
    }

    /**
     * Factory for a nullable column.
     */
    public static Column nullable(String name, CanonicalType type) {
        return new Column(name, type.withNullable(true));
    }

    public boolean isNullable() {
        return type.nullable();
    }
}
