package org.saiql.engine.optimizer;

import org.saiql.engine.plan.AggregateNode;
import org.saiql.engine.plan.FilterNode;
import org.saiql.engine.plan.JoinNode;
import org.saiql.engine.plan.LimitNode;
import org.saiql.engine.plan.ProjectNode;
import org.saiql.engine.plan.RelationNode;
import org.saiql.engine.plan.RelationNodeVisitor;
import org.saiql.engine.plan.ScanNode;
import org.saiql.engine.plan.SinkNode;
import org.saiql.engine.plan.SortNode;

/**
 * Bottom-up rewrite that rebuilds every node from its rewritten inputs.
 * Rules override the nodes they change.
 */
abstract class PlanRewriter implements RelationNodeVisitor<RelationNode> {

    RelationNode rewrite(RelationNode node) {
        return node.accept(this);
    }

    @Override
    public RelationNode visit(ScanNode scan) {
        return scan;
    }

    @Override
    public RelationNode visit(FilterNode filter) {
        return new FilterNode(rewrite(filter.source()), filter.condition());
    }

    @Override
    public RelationNode visit(ProjectNode project) {
        return new ProjectNode(rewrite(project.source()), project.projections(), project.distinct());
    }

    @Override
    public RelationNode visit(JoinNode join) {
        return new JoinNode(rewrite(join.left()), rewrite(join.right()), join.condition(), join.joinType());
    }

    @Override
    public RelationNode visit(AggregateNode aggregate) {
        return new AggregateNode(rewrite(aggregate.source()), aggregate.outputs(), aggregate.groupBy());
    }

    @Override
    public RelationNode visit(SortNode sort) {
        return new SortNode(rewrite(sort.source()), sort.items());
    }

    @Override
    public RelationNode visit(LimitNode limit) {
        return new LimitNode(rewrite(limit.source()), limit.limit(), limit.offset());
    }

    @Override
    public RelationNode visit(SinkNode sink) {
        return sink.withSource(rewrite(sink.source()));
    }
}
