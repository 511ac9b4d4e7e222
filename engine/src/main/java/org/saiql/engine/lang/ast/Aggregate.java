package org.saiql.engine.lang.ast;

import java.util.List;
import java.util.Objects;

/**
 * Aggregation over a relation.
 *
 * <p>The output columns follow {@code items} in order; every plain column
 * must also be a grouping column.
 *
 * @param items   plain columns and aggregate calls, at least one call
 * @param groupBy grouping columns, possibly empty
 */
public record Aggregate(List<SelectItem> items, List<ColumnRef> groupBy, RelationAst source) implements RelationAst {

    public Aggregate {
        items = List.copyOf(items);
        groupBy = List.copyOf(groupBy);
        Objects.requireNonNull(source, "Source cannot be null");
        if (items.stream().noneMatch(AggregateCall.class::isInstance)) {
            throw new IllegalArgumentException("Aggregate requires at least one call");
        }
    }

    /**
     * The plain columns of the select list, in order.
     */
    public List<ColumnList.Item> columns() {
        return items.stream()
                .filter(ColumnList.Item.class::isInstance)
                .map(ColumnList.Item.class::cast)
                .toList();
    }

    /**
     * The aggregate calls of the select list, in order.
     */
    public List<AggregateCall> calls() {
        return items.stream()
                .filter(AggregateCall.class::isInstance)
                .map(AggregateCall.class::cast)
                .toList();
    }

    @Override
    public <T> T accept(RelationAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
