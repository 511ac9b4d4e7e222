package org.saiql.engine.transpiler;

import org.saiql.engine.types.CanonicalType;

import java.util.Objects;

/**
 * A value bound to a statement placeholder.
 *
 * @param index 1-based position, in the order placeholders appear in the SQL
 * @param value String, Long, BigDecimal, Boolean or null
 * @param type  canonical type of the column the value meets
 */
public record BoundParameter(int index, Object value, CanonicalType type) {

    public BoundParameter {
        Objects.requireNonNull(type, "Type cannot be null");
        if (index < 1) {
            throw new IllegalArgumentException("Parameter index is 1-based, got " + index);
        }
    }
}
