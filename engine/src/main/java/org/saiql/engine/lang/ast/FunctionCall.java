package org.saiql.engine.lang.ast;

import java.util.List;
import java.util.Objects;

/**
 * A scalar function call. The name is resolved by the validator.
 */
public record FunctionCall(String name, List<ExprAst> arguments) implements ExprAst {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        arguments = List.copyOf(arguments);
    }

    @Override
    public <T> T accept(ExprAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
