package org.saiql.engine.lang.ast;

import java.util.Objects;

public record IsNull(ExprAst operand, boolean negated) implements ExprAst {

    public IsNull {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public <T> T accept(ExprAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
