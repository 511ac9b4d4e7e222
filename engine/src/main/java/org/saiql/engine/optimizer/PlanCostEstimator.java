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
 * Rolls the cost model up over a whole read plan.
 *
 * <p>Scans cost their chosen access path, or a full scan when none was
 * costed. Each join adds {@link CostModel#joinCost} over its inputs' row
 * estimates. Other nodes add no cost.
 */
final class PlanCostEstimator implements RelationNodeVisitor<PlanCostEstimator.Estimate> {

    record Estimate(double rows, double cost) {
    }

    private final OptimizerContext context;

    PlanCostEstimator(OptimizerContext context) {
        this.context = context;
    }

    double estimate(RelationNode plan) {
        return plan.accept(this).cost();
    }

    @Override
    public Estimate visit(ScanNode scan) {
        CardinalityEstimate estimate = context.estimate(scan.table(), null);
        Double cost = scan.accessPath().cost();
        return new Estimate(estimate.tableRows(),
                cost != null ? cost : CostModel.fullScanCost(estimate.tableRows()));
    }

    @Override
    public Estimate visit(FilterNode filter) {
        if (filter.source() instanceof ScanNode scan) {
            CardinalityEstimate estimate = context.estimate(scan.table(), filter.condition());
            Double cost = scan.accessPath().cost();
            return new Estimate(estimate.estimatedRows(),
                    cost != null ? cost : CostModel.fullScanCost(estimate.tableRows()));
        }
        Estimate source = filter.source().accept(this);
        return new Estimate(source.rows() * CostModel.DEFAULT_SELECTIVITY, source.cost());
    }

    @Override
    public Estimate visit(JoinNode join) {
        Estimate left = join.left().accept(this);
        Estimate right = join.right().accept(this);
        double rows = CostModel.joinRows(left.rows(), right.rows(), join.condition() != null);
        return new Estimate(rows, left.cost() + right.cost() + CostModel.joinCost(left.rows(), right.rows()));
    }

    @Override
    public Estimate visit(AggregateNode aggregate) {
        Estimate source = aggregate.source().accept(this);
        double rows = aggregate.groupBy().isEmpty() ? 1 : source.rows() * CostModel.DEFAULT_SELECTIVITY;
        return new Estimate(rows, source.cost());
    }

    @Override
    public Estimate visit(ProjectNode project) {
        return project.source().accept(this);
    }

    @Override
    public Estimate visit(SortNode sort) {
        return sort.source().accept(this);
    }

    @Override
    public Estimate visit(LimitNode limit) {
        Estimate source = limit.source().accept(this);
        if (limit.limit() == null) {
            return source;
        }
        return new Estimate(Math.min(source.rows(), limit.limit()), source.cost());
    }

    @Override
    public Estimate visit(SinkNode sink) {
        return sink.source().accept(this);
    }
}
