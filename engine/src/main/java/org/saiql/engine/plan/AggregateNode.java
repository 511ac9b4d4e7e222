package org.saiql.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Grouped aggregation. Output columns are {@code outputs}, in the order
 * the query listed them.
 *
 * @param source  input relation
 * @param outputs grouping columns and aggregate calls
 * @param groupBy grouping keys, possibly empty for a global aggregate
 */
public record AggregateNode(RelationNode source, List<AggregateOutput> outputs,
                            List<ColumnReference> groupBy) implements RelationNode {

    public AggregateNode {
        Objects.requireNonNull(source, "Source cannot be null");
        outputs = List.copyOf(outputs);
        groupBy = List.copyOf(groupBy);
        if (outputs.stream().noneMatch(AggregateCall.class::isInstance)) {
            throw new IllegalArgumentException("Aggregate requires at least one call");
        }
    }

    /**
     * Grouping columns that appear in the output.
     */
    public List<Projection> groupColumns() {
        return outputs.stream().filter(Projection.class::isInstance).map(Projection.class::cast).toList();
    }

    public List<AggregateCall> calls() {
        return outputs.stream().filter(AggregateCall.class::isInstance).map(AggregateCall.class::cast).toList();
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
