package org.saiql.engine.optimizer;

import java.util.List;

/**
 * How much rewriting a compilation asks for.
 */
public enum OptimizationLevel {
    /**
     * Plan goes to the generator as validated.
     */
    NONE,
    /**
     * Local rewrites only: predicate pushdown and projection pruning.
     */
    BASIC,
    /**
     * Adds join reordering and access path selection.
     */
    STANDARD,
    /**
     * Same rule set as {@link #STANDARD}; no rule here may change a query's
     * results, so there is nothing further to enable.
     */
    AGGRESSIVE;

    List<OptimizationRule> rules() {
        return switch (this) {
            case NONE -> List.of();
            case BASIC -> List.of(new PredicatePushdownRule(), new ProjectionPruningRule());
            case STANDARD, AGGRESSIVE -> List.of(
                    new PredicatePushdownRule(),
                    new JoinReorderRule(),
                    new AccessPathRule(),
                    new ProjectionPruningRule());
        };
    }
}
