package org.saiql.engine.optimizer;

import org.saiql.engine.plan.RelationNode;

/**
 * A rewrite of a read plan into an equivalent, cheaper one.
 *
 * <p>Rules must be idempotent: applying a rule to its own output returns an
 * equal plan. The optimizer applies rules until none changes the plan.
 */
public interface OptimizationRule {

    /**
     * @param plan    the input plan
     * @param context index metadata and cost model for this run
     * @return the rewritten plan, or an equal plan when nothing applies
     */
    RelationNode apply(RelationNode plan, OptimizerContext context);

    /**
     * Returns the name of this optimization rule, used in explain output and logs.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
