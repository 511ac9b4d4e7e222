package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;

import java.util.Objects;

/**
 * One output column of a projection.
 *
 * @param expression the value
 * @param alias      output name, unique within the projection
 */
public record Projection(ColumnReference expression, String alias) implements AggregateOutput {

    public Projection {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
    }

    @Override
    public CanonicalType type() {
        return expression.type();
    }
}
