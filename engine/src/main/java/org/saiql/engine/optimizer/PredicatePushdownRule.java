package org.saiql.engine.optimizer;

import org.saiql.engine.plan.Expression;
import org.saiql.engine.plan.Expressions;
import org.saiql.engine.plan.FilterNode;
import org.saiql.engine.plan.JoinNode;
import org.saiql.engine.plan.JoinNode.JoinType;
import org.saiql.engine.plan.PlanNodes;
import org.saiql.engine.plan.RelationNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Moves filter conjuncts towards the scans they read.
 *
 * <pre>
 *   Filter(Filter(x))                    -> Filter(x) with both conditions
 *   Filter(a.x = 1 AND b.y = 2, Join(a, b)) -> Join(Filter(a), Filter(b))
 *   Filter(a.id = b.a_id, Cross(a, b))   -> Inner(a, b, a.id = b.a_id)
 * </pre>
 *
 * <p>A conjunct only moves to the preserved side of an outer join; below a
 * full outer join nothing moves. Conjuncts over both inputs are merged into
 * inner and cross join conditions.
 */
public final class PredicatePushdownRule implements OptimizationRule {

    @Override
    public RelationNode apply(RelationNode plan, OptimizerContext context) {
        return new Pushdown().rewrite(plan);
    }

    private static final class Pushdown extends PlanRewriter {

        @Override
        public RelationNode visit(FilterNode filter) {
            return push(rewrite(filter.source()), Expressions.conjuncts(filter.condition()));
        }

        private RelationNode push(RelationNode target, List<Expression> conjuncts) {
            if (target instanceof FilterNode inner) {
                List<Expression> merged = new ArrayList<>(Expressions.conjuncts(inner.condition()));
                merged.addAll(conjuncts);
                return push(inner.source(), merged);
            }
            if (target instanceof JoinNode join) {
                return pushIntoJoin(join, conjuncts);
            }
            return new FilterNode(target, Expressions.and(conjuncts));
        }

        private RelationNode pushIntoJoin(JoinNode join, List<Expression> conjuncts) {
            Set<String> leftAliases = PlanNodes.aliases(join.left());
            Set<String> rightAliases = PlanNodes.aliases(join.right());
            JoinType type = join.joinType();

            List<Expression> toLeft = new ArrayList<>();
            List<Expression> toRight = new ArrayList<>();
            List<Expression> toCondition = new ArrayList<>();
            List<Expression> remaining = new ArrayList<>();
            for (Expression conjunct : conjuncts) {
                Set<String> used = Expressions.aliases(conjunct);
                if (used.isEmpty()) {
                    remaining.add(conjunct);
                } else if (leftAliases.containsAll(used) && !type.preservesRight()) {
                    toLeft.add(conjunct);
                } else if (rightAliases.containsAll(used) && !type.preservesLeft()) {
                    toRight.add(conjunct);
                } else if (type.isReorderable() && !leftAliases.containsAll(used) && !rightAliases.containsAll(used)) {
                    toCondition.add(conjunct);
                } else {
                    remaining.add(conjunct);
                }
            }

            RelationNode left = toLeft.isEmpty() ? join.left() : push(join.left(), toLeft);
            RelationNode right = toRight.isEmpty() ? join.right() : push(join.right(), toRight);
            JoinNode rewritten;
            if (toCondition.isEmpty()) {
                rewritten = new JoinNode(left, right, join.condition(), type);
            } else {
                List<Expression> condition = new ArrayList<>();
                if (join.condition() != null) {
                    condition.addAll(Expressions.conjuncts(join.condition()));
                }
                condition.addAll(toCondition);
                rewritten = JoinNode.inner(left, right, Expressions.and(condition));
            }
            return remaining.isEmpty() ? rewritten : new FilterNode(rewritten, Expressions.and(remaining));
        }
    }
}
