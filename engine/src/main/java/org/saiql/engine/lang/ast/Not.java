package org.saiql.engine.lang.ast;

import java.util.Objects;

public record Not(ExprAst operand) implements ExprAst {

    public Not {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public <T> T accept(ExprAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
