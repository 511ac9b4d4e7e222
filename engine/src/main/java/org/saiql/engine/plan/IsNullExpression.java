package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;

import java.util.Objects;

public record IsNullExpression(Expression operand, boolean negated) implements Expression {

    public IsNullExpression {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public CanonicalType type() {
        return CanonicalType.of(TypeKind.BOOLEAN);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitIsNull(this);
    }
}
