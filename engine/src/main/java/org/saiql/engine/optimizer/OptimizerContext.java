package org.saiql.engine.optimizer;

import org.saiql.engine.plan.Expression;
import org.saiql.engine.store.Table;

import java.util.Objects;

/**
 * Per-run state handed to every rule.
 */
public final class OptimizerContext {

    private final IndexMetadata indexMetadata;

    public OptimizerContext(IndexMetadata indexMetadata) {
        this.indexMetadata = Objects.requireNonNull(indexMetadata, "Index metadata cannot be null");
    }

    public CardinalityEstimate estimate(Table table, Expression predicate) {
        return Objects.requireNonNull(indexMetadata.estimate(table, predicate),
                "Index metadata returned no estimate for " + table.name());
    }
}
