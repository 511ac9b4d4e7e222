package org.saiql.engine.lang.ast;

import java.util.List;
import java.util.Objects;

public record InList(ExprAst operand, List<Literal> values, boolean negated) implements ExprAst {

    public InList {
        Objects.requireNonNull(operand, "Operand cannot be null");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN list cannot be empty");
        }
    }

    @Override
    public <T> T accept(ExprAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
