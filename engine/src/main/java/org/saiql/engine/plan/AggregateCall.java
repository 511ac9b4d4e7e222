package org.saiql.engine.plan;

import org.saiql.engine.lang.ast.AggregateFunction;
import org.saiql.engine.types.CanonicalType;

import java.util.Objects;

/**
 * One aggregate output column.
 *
 * @param function   aggregate function
 * @param argument   aggregated column, null for {@code COUNT(*)}
 * @param alias      output name
 * @param resultType type of the aggregate value
 */
public record AggregateCall(AggregateFunction function, ColumnReference argument, String alias,
                            CanonicalType resultType) implements AggregateOutput {

    public AggregateCall {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
        Objects.requireNonNull(resultType, "Result type cannot be null");
        if (argument == null && function != AggregateFunction.COUNT) {
            throw new IllegalArgumentException(function + " requires an argument");
        }
    }

    public boolean isCountStar() {
        return argument == null;
    }

    @Override
    public CanonicalType type() {
        return resultType;
    }
}
