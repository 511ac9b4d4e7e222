package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;

import java.util.Objects;

/**
 * A binary comparison.
 */
public record ComparisonExpression(Expression left, ComparisonOperator operator, Expression right)
        implements Expression {

    private static final CanonicalType BOOLEAN = CanonicalType.of(TypeKind.BOOLEAN);

    public enum ComparisonOperator {
        EQUALS("="),
        NOT_EQUALS("<>"),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUALS("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUALS(">="),
        LIKE("LIKE"),
        /** Case-insensitive LIKE; rendered per dialect. */
        ILIKE("ILIKE");

        private final String sql;

        ComparisonOperator(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }

        /**
         * True for operators an index on the left operand can serve as a range.
         */
        public boolean isRange() {
            return this == LESS_THAN || this == LESS_THAN_OR_EQUALS
                    || this == GREATER_THAN || this == GREATER_THAN_OR_EQUALS;
        }
    }

    public ComparisonExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static ComparisonExpression equalTo(Expression left, Expression right) {
        return new ComparisonExpression(left, ComparisonOperator.EQUALS, right);
    }

    @Override
    public CanonicalType type() {
        return BOOLEAN;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.toSql() + " " + right + ")";
    }
}
