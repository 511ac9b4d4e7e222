package org.saiql.engine.optimizer;

import org.saiql.engine.CompileWarning;
import org.saiql.engine.ExplainInfo;
import org.saiql.engine.WarningCode;
import org.saiql.engine.plan.MutationNode;
import org.saiql.engine.plan.PlanNode;
import org.saiql.engine.plan.PlanNodes;
import org.saiql.engine.plan.RelationNode;
import org.saiql.engine.plan.ScanNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Applies rewrite rules to a read plan until none of them changes it.
 *
 * <p>The budget is checked between rule applications. When it runs out, or
 * the caller cancels, the best plan so far is returned with an
 * {@link WarningCode#OPTIMIZER_TIMEOUT} warning. A rule that throws is
 * disabled for the rest of the run. Optimization never fails a compilation.
 */
public final class Optimizer {

    private static final Logger log = LoggerFactory.getLogger(Optimizer.class);

    private final List<OptimizationRule> rules;

    public Optimizer(List<OptimizationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Pushdown, join order, access paths, then pruning.
     */
    public static Optimizer standard() {
        return forLevel(OptimizationLevel.STANDARD);
    }

    public static Optimizer forLevel(OptimizationLevel level) {
        return new Optimizer(Objects.requireNonNull(level, "Optimization level cannot be null").rules());
    }

    public OptimizerResult optimize(PlanNode plan, IndexMetadata indexMetadata, OptimizerBudget budget) {
        Objects.requireNonNull(plan, "Plan cannot be null");
        Objects.requireNonNull(budget, "Budget cannot be null");
        if (plan instanceof MutationNode) {
            return new OptimizerResult(plan, ExplainInfo.empty(), List.of(), false);
        }

        OptimizerContext context = new OptimizerContext(indexMetadata);
        if (rules.isEmpty()) {
            return new OptimizerResult(plan, explain((RelationNode) plan, Set.of(), 0, context), List.of(), false);
        }
        Instant deadline = budget.clock().instant().plus(budget.deadline());
        List<OptimizationRule> active = new ArrayList<>(rules);
        Set<String> applied = new LinkedHashSet<>();
        List<CompileWarning> warnings = new ArrayList<>();

        RelationNode current = (RelationNode) plan;
        int iterations = 0;
        boolean changed = true;
        String stopReason = null;

        passes:
        while (changed) {
            if (iterations >= budget.maxIterations()) {
                stopReason = "iteration limit of " + budget.maxIterations() + " reached";
                break;
            }
            iterations++;
            changed = false;
            for (OptimizationRule rule : List.copyOf(active)) {
                if (budget.cancellation().isCancelled()) {
                    stopReason = "cancelled";
                    break passes;
                }
                if (budget.clock().instant().isAfter(deadline)) {
                    stopReason = "deadline of " + budget.deadline().toMillis() + " ms exceeded";
                    break passes;
                }
                RelationNode next;
                try {
                    next = Objects.requireNonNull(rule.apply(current, context), "Rule returned no plan");
                } catch (RuntimeException e) {
                    log.warn("Optimizer rule {} failed and is disabled for this query", rule.name(), e);
                    active.remove(rule);
                    warnings.add(new CompileWarning(WarningCode.OPTIMIZER_RULE_FAILED,
                            rule.name() + " failed: " + e.getMessage()));
                    continue;
                }
                if (!next.equals(current)) {
                    log.debug("{} rewrote the plan in pass {}", rule.name(), iterations);
                    applied.add(rule.name());
                    current = next;
                    changed = true;
                }
            }
        }

        boolean timedOut = stopReason != null;
        if (timedOut) {
            log.warn("Optimizer stopped early ({}); returning the best plan found", stopReason);
            warnings.add(new CompileWarning(WarningCode.OPTIMIZER_TIMEOUT,
                    "Optimization stopped early: " + stopReason));
        }
        return new OptimizerResult(current, explain(current, applied, iterations, context), warnings, timedOut);
    }

    private static ExplainInfo explain(RelationNode plan, Set<String> applied, int iterations,
                                       OptimizerContext context) {
        List<String> joinOrder = new ArrayList<>();
        Map<String, String> accessPaths = new LinkedHashMap<>();
        for (ScanNode scan : PlanNodes.scans(plan)) {
            joinOrder.add(scan.alias());
            accessPaths.put(scan.alias(), scan.accessPath().describe());
        }
        double cost = new PlanCostEstimator(context).estimate(plan);
        return new ExplainInfo(joinOrder, accessPaths, new ArrayList<>(applied), iterations, cost);
    }
}
