package org.saiql.migration;

import org.saiql.engine.types.TypeMapping;

import java.util.Objects;

/**
 * How one column moves to the target.
 *
 * @param source     The source column
 * @param mapping    The type mapping, or null when an override replaced an unmapped type
 * @param targetType The target DDL type
 * @param overridden Whether the target type is an override fallback
 */
public record ColumnMigration(SourceColumn source, TypeMapping mapping, String targetType, boolean overridden) {

    public ColumnMigration {
        Objects.requireNonNull(source, "Source column cannot be null");
        Objects.requireNonNull(targetType, "Target type cannot be null");
        if (mapping == null && !overridden) {
            throw new IllegalArgumentException("Column " + source.name() + " needs a mapping unless overridden");
        }
    }

    public String name() {
        return source.name();
    }

    public boolean lossy() {
        return overridden || mapping.lossy();
    }

    public String describe() {
        String line = source.name() + ": " + source.typeSignature() + " -> " + targetType;
        if (overridden) {
            return line + " (override)";
        }
        return mapping.lossy() ? line + " (lossy: " + mapping.reason() + ")" : line;
    }
}
