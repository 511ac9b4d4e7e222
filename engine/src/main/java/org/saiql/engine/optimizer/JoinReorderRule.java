package org.saiql.engine.optimizer;

import org.saiql.engine.plan.Expression;
import org.saiql.engine.plan.Expressions;
import org.saiql.engine.plan.FilterNode;
import org.saiql.engine.plan.JoinNode;
import org.saiql.engine.plan.PlanNodes;
import org.saiql.engine.plan.RelationNode;
import org.saiql.engine.plan.ScanNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy join ordering over chains of inner and cross joins.
 *
 * <p>A chain is flattened into its inputs and conjuncts. The smallest input
 * starts the order; then, preferring inputs connected to what is already
 * joined, the input giving the smallest intermediate result is appended.
 * Ties keep the input order. The chain is rebuilt left-deep, each conjunct
 * attached to the first join that covers its tables. Outer joins are never
 * reordered, only their inputs.
 */
public final class JoinReorderRule implements OptimizationRule {

    @Override
    public RelationNode apply(RelationNode plan, OptimizerContext context) {
        return new Reorder(context).rewrite(plan);
    }

    private record Input(RelationNode node, Set<String> aliases, double rows) {
    }

    private static final class Reorder extends PlanRewriter {
        private final OptimizerContext context;

        Reorder(OptimizerContext context) {
            this.context = context;
        }

        @Override
        public RelationNode visit(JoinNode join) {
            if (!join.joinType().isReorderable()) {
                return super.visit(join);
            }
            List<RelationNode> leaves = new ArrayList<>();
            List<Expression> conjuncts = new ArrayList<>();
            flatten(join, leaves, conjuncts);

            List<Input> inputs = new ArrayList<>();
            for (RelationNode leaf : leaves) {
                RelationNode rewritten = rewrite(leaf);
                inputs.add(new Input(rewritten, PlanNodes.aliases(rewritten), rows(rewritten)));
            }
            return rebuild(order(inputs, conjuncts), conjuncts);
        }

        private void flatten(RelationNode node, List<RelationNode> leaves, List<Expression> conjuncts) {
            if (node instanceof JoinNode join && join.joinType().isReorderable()) {
                flatten(join.left(), leaves, conjuncts);
                flatten(join.right(), leaves, conjuncts);
                if (join.condition() != null) {
                    conjuncts.addAll(Expressions.conjuncts(join.condition()));
                }
            } else {
                leaves.add(node);
            }
        }

        private double rows(RelationNode input) {
            if (input instanceof ScanNode scan) {
                return context.estimate(scan.table(), null).tableRows();
            }
            if (input instanceof FilterNode filter && filter.source() instanceof ScanNode scan) {
                return context.estimate(scan.table(), filter.condition()).estimatedRows();
            }
            double rows = 0;
            for (ScanNode scan : PlanNodes.scans(input)) {
                rows = Math.max(rows, context.estimate(scan.table(), null).tableRows());
            }
            return rows;
        }

        private List<Input> order(List<Input> inputs, List<Expression> conjuncts) {
            List<Input> remaining = new ArrayList<>(inputs);
            Input start = remaining.get(0);
            for (Input input : remaining) {
                if (input.rows() < start.rows()) {
                    start = input;
                }
            }
            remaining.remove(start);
            List<Input> ordered = new ArrayList<>(List.of(start));
            Set<String> joined = new HashSet<>(start.aliases());
            double rows = start.rows();

            while (!remaining.isEmpty()) {
                Input best = null;
                boolean bestConnected = false;
                double bestRows = Double.MAX_VALUE;
                for (Input candidate : remaining) {
                    boolean connected = connects(joined, candidate.aliases(), conjuncts);
                    double candidateRows = CostModel.joinRows(rows, candidate.rows(), connected);
                    boolean better = best == null
                            || (connected && !bestConnected)
                            || (connected == bestConnected && candidateRows < bestRows);
                    if (better) {
                        best = candidate;
                        bestConnected = connected;
                        bestRows = candidateRows;
                    }
                }
                remaining.remove(best);
                ordered.add(best);
                joined.addAll(best.aliases());
                rows = bestRows;
            }
            return ordered;
        }

        private static boolean connects(Set<String> joined, Set<String> candidate, List<Expression> conjuncts) {
            for (Expression conjunct : conjuncts) {
                Set<String> used = Expressions.aliases(conjunct);
                boolean touchesJoined = used.stream().anyMatch(joined::contains);
                boolean touchesCandidate = used.stream().anyMatch(candidate::contains);
                boolean covered = used.stream().allMatch(a -> joined.contains(a) || candidate.contains(a));
                if (touchesJoined && touchesCandidate && covered) {
                    return true;
                }
            }
            return false;
        }

        private static RelationNode rebuild(List<Input> ordered, List<Expression> conjuncts) {
            List<Expression> pending = new ArrayList<>(conjuncts);
            RelationNode current = ordered.get(0).node();
            Set<String> covered = new HashSet<>(ordered.get(0).aliases());
            for (int i = 1; i < ordered.size(); i++) {
                Input next = ordered.get(i);
                covered.addAll(next.aliases());
                List<Expression> attached = new ArrayList<>();
                for (Expression conjunct : pending) {
                    if (covered.containsAll(Expressions.aliases(conjunct))) {
                        attached.add(conjunct);
                    }
                }
                pending.removeAll(attached);
                current = attached.isEmpty()
                        ? JoinNode.cross(current, next.node())
                        : JoinNode.inner(current, next.node(), Expressions.and(attached));
            }
            return current;
        }
    }
}
