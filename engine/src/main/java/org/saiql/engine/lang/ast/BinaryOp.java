package org.saiql.engine.lang.ast;

import java.util.Objects;

public record BinaryOp(Operator operator, ExprAst left, ExprAst right) implements ExprAst {

    public enum Operator {
        EQ, NE, LT, LE, GT, GE, LIKE, ILIKE, AND, OR;

        public boolean isLogical() {
            return this == AND || this == OR;
        }
    }

    public BinaryOp {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    @Override
    public <T> T accept(ExprAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
