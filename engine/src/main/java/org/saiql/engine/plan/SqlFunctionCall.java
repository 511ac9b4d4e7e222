package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;
import org.saiql.engine.types.TypeKind;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A scalar function call. Dialects may spell the function differently.
 */
public record SqlFunctionCall(ScalarFunction function, List<Expression> arguments, CanonicalType type)
        implements Expression {

    public enum ScalarFunction {
        LOWER(1, true),
        UPPER(1, true),
        TRIM(1, true),
        LENGTH(1, true),
        /** Random ordering key; produced by the validator, not callable from queries. */
        RANDOM(0, false);

        private final int arity;
        private final boolean callable;

        ScalarFunction(int arity, boolean callable) {
            this.arity = arity;
            this.callable = callable;
        }

        public int arity() {
            return arity;
        }

        /**
         * Resolves a function name written in a query.
         */
        public static Optional<ScalarFunction> fromName(String name) {
            String upper = name.toUpperCase(Locale.ROOT);
            return Arrays.stream(values()).filter(f -> f.callable && f.name().equals(upper)).findFirst();
        }
    }

    public SqlFunctionCall {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        arguments = List.copyOf(arguments);
        if (arguments.size() != function.arity()) {
            throw new IllegalArgumentException(function + " takes " + function.arity() + " argument(s)");
        }
    }

    public static SqlFunctionCall random() {
        return new SqlFunctionCall(ScalarFunction.RANDOM, List.of(), CanonicalType.of(TypeKind.FLOAT64));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return function + arguments.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
