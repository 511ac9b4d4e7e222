package org.saiql.engine.optimizer;

import org.saiql.engine.plan.AccessPath;
import org.saiql.engine.plan.ColumnReference;
import org.saiql.engine.plan.ComparisonExpression;
import org.saiql.engine.plan.ComparisonExpression.ComparisonOperator;
import org.saiql.engine.plan.Expression;
import org.saiql.engine.plan.Expressions;
import org.saiql.engine.plan.FilterNode;
import org.saiql.engine.plan.Literal;
import org.saiql.engine.plan.RelationNode;
import org.saiql.engine.plan.ScanNode;

/**
 * Chooses between a full scan and an index lookup for every scan.
 *
 * <p>An index qualifies when a conjunct of the filter directly above the scan
 * compares the index's leading column with a literal: equality for HASH,
 * equality or a range for BTREE. The cheaper path wins; ties go to the full
 * scan.
 */
public final class AccessPathRule implements OptimizationRule {

    @Override
    public RelationNode apply(RelationNode plan, OptimizerContext context) {
        return new Chooser(context).rewrite(plan);
    }

    private static final class Chooser extends PlanRewriter {
        private final OptimizerContext context;

        Chooser(OptimizerContext context) {
            this.context = context;
        }

        @Override
        public RelationNode visit(ScanNode scan) {
            return scan.withAccessPath(choose(scan, null));
        }

        @Override
        public RelationNode visit(FilterNode filter) {
            if (filter.source() instanceof ScanNode scan) {
                return new FilterNode(scan.withAccessPath(choose(scan, filter.condition())), filter.condition());
            }
            return super.visit(filter);
        }

        private AccessPath choose(ScanNode scan, Expression predicate) {
            CardinalityEstimate estimate = context.estimate(scan.table(), predicate);
            long tableRows = estimate.tableRows();
            AccessPath best = AccessPath.fullScan(tableRows, CostModel.fullScanCost(tableRows));
            if (predicate == null) {
                return best;
            }
            for (IndexDescriptor index : estimate.indexes()) {
                if (!serves(index, scan.alias(), predicate)) {
                    continue;
                }
                double cost = CostModel.indexLookupCost(tableRows, estimate.estimatedRows());
                if (cost < best.cost()) {
                    best = AccessPath.indexLookup(index.name(), estimate.estimatedRows(), cost);
                }
            }
            return best;
        }

        private static boolean serves(IndexDescriptor index, String alias, Expression predicate) {
            for (Expression conjunct : Expressions.conjuncts(predicate)) {
                if (!(conjunct instanceof ComparisonExpression comparison)) {
                    continue;
                }
                ColumnReference column = null;
                if (comparison.left() instanceof ColumnReference ref && comparison.right() instanceof Literal) {
                    column = ref;
                } else if (comparison.right() instanceof ColumnReference ref && comparison.left() instanceof Literal) {
                    column = ref;
                }
                if (column == null || !column.tableAlias().equals(alias)
                        || !column.columnName().equalsIgnoreCase(index.leadingColumn())) {
                    continue;
                }
                ComparisonOperator operator = comparison.operator();
                if (operator == ComparisonOperator.EQUALS
                        || (index.kind() == IndexKind.BTREE && operator.isRange())) {
                    return true;
                }
            }
            return false;
        }
    }
}
