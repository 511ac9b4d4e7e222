package org.saiql.engine.plan;

/**
 * Sealed interface representing a relational plan node that produces rows.
 */
public sealed interface RelationNode extends PlanNode
        permits ScanNode, FilterNode, ProjectNode, JoinNode, AggregateNode, SortNode, LimitNode, SinkNode {

    /**
     * Accept a visitor for tree traversal.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of the visitor
     */
    <T> T accept(RelationNodeVisitor<T> visitor);
}
