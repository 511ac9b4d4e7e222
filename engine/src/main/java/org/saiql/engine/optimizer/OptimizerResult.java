package org.saiql.engine.optimizer;

import org.saiql.engine.CompileWarning;
import org.saiql.engine.ExplainInfo;
import org.saiql.engine.plan.PlanNode;

import java.util.List;
import java.util.Objects;

/**
 * @param plan     best plan found
 * @param explain  decisions taken
 * @param warnings timeout and rule failure diagnostics
 * @param timedOut whether the budget stopped the run before a fixed point
 */
public record OptimizerResult(PlanNode plan, ExplainInfo explain, List<CompileWarning> warnings, boolean timedOut) {

    public OptimizerResult {
        Objects.requireNonNull(plan, "Plan cannot be null");
        Objects.requireNonNull(explain, "Explain cannot be null");
        warnings = List.copyOf(warnings);
    }
}
