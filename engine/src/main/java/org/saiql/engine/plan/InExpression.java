package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;

import java.util.List;
import java.util.Objects;

/**
 * {@code operand [NOT] IN (v1, v2, ...)} over literal values.
 */
public record InExpression(Expression operand, List<Literal> values, boolean negated) implements Expression {

    public InExpression {
        Objects.requireNonNull(operand, "Operand cannot be null");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN requires at least one value");
        }
    }

    @Override
    public CanonicalType type() {
        return CanonicalType.of(TypeKind.BOOLEAN);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitIn(this);
    }
}
