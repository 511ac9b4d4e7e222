package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * One aggregate in a select list.
 *
 * @param argument aggregated column, or null for {@code *}
 * @param alias    output name, or null to derive one
 */
public record AggregateCall(AggregateFunction function, ColumnRef argument, String alias) implements SelectItem {

    public AggregateCall {
        Objects.requireNonNull(function, "Aggregate function cannot be null");
    }
}
