package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;

import java.util.Objects;

/**
 * A column bound to the scan that produces it.
 *
 * @param tableAlias alias of the owning scan
 * @param columnName catalog column name
 * @param type       catalog column type
 */
public record ColumnReference(String tableAlias, String columnName, CanonicalType type) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(tableAlias, "Table alias cannot be null");
        Objects.requireNonNull(columnName, "Column name cannot be null");
        Objects.requireNonNull(type, "Column type cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return tableAlias + "." + columnName;
    }
}
