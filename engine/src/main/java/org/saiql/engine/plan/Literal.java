package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;

import java.util.Objects;

/**
 * A constant. The code generator always binds it as a parameter.
 *
 * @param value String, Long, BigDecimal, Boolean, or null for SQL NULL
 * @param type  canonical type of the column or expression the literal meets
 */
public record Literal(Object value, CanonicalType type) implements Expression {

    public Literal {
        Objects.requireNonNull(type, "Literal type cannot be null");
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return value instanceof String s ? "'" + s + "'" : String.valueOf(value);
    }
}
