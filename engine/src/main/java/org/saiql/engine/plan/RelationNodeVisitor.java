package org.saiql.engine.plan;

/**
 * Visitor interface for traversing RelationNode trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface RelationNodeVisitor<T> {

    T visit(ScanNode scan);

    T visit(FilterNode filter);

    T visit(ProjectNode project);

    T visit(JoinNode join);

    T visit(AggregateNode aggregate);

    T visit(SortNode sort);

    T visit(LimitNode limit);

    T visit(SinkNode sink);
}
