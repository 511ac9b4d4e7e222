package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;

import java.util.List;
import java.util.Objects;

/**
 * Represents a logical expression combining multiple conditions.
 *
 * @param operator The logical operator (AND, OR, NOT)
 * @param operands The operand expressions
 */
public record LogicalExpression(LogicalOperator operator, List<Expression> operands) implements Expression {

    private static final CanonicalType BOOLEAN = CanonicalType.of(TypeKind.BOOLEAN);

    public enum LogicalOperator {
        AND,
        OR,
        NOT
    }

    public LogicalExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        operands = List.copyOf(operands);
        if (operator == LogicalOperator.NOT && operands.size() != 1) {
            throw new IllegalArgumentException("NOT operator requires exactly 1 operand");
        }
        if (operator != LogicalOperator.NOT && operands.size() < 2) {
            throw new IllegalArgumentException(operator + " operator requires at least 2 operands");
        }
    }

    public static LogicalExpression or(Expression left, Expression right) {
        return new LogicalExpression(LogicalOperator.OR, List.of(left, right));
    }

    public static LogicalExpression not(Expression expression) {
        return new LogicalExpression(LogicalOperator.NOT, List.of(expression));
    }

    @Override
    public CanonicalType type() {
        return BOOLEAN;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLogical(this);
    }
}
