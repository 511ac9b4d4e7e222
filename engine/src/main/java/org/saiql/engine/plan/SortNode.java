package org.saiql.engine.plan;

import java.util.List;
import java.util.Objects;

public record SortNode(RelationNode source, List<SortItem> items) implements RelationNode {

    /**
     * @param key        column or {@code RANDOM()}
     * @param descending sort direction
     */
    public record SortItem(Expression key, boolean descending) {
        public SortItem {
            Objects.requireNonNull(key, "Sort key cannot be null");
        }
    }

    public SortNode {
        Objects.requireNonNull(source, "Source cannot be null");
        items = List.copyOf(items);
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Sort requires at least one key");
        }
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
