package org.saiql.engine.optimizer;

import org.saiql.engine.plan.Expression;
import org.saiql.engine.plan.Expressions;
import org.saiql.engine.store.Table;

import java.util.List;

/**
 * Statistics and index hints supplied by the storage layer.
 *
 * <p>Implementations are consulted synchronously during optimization and must
 * answer from memory.
 */
@FunctionalInterface
public interface IndexMetadata {

    /**
     * Estimates a table's rows under a predicate.
     *
     * @param table     the table
     * @param predicate filter over the table's columns, or null for none
     */
    CardinalityEstimate estimate(Table table, Expression predicate);

    /**
     * Metadata for when the storage layer offers none: every table has
     * {@link CostModel#DEFAULT_TABLE_ROWS} rows, each conjunct keeps
     * {@link CostModel#DEFAULT_SELECTIVITY} of them, and there are no indexes.
     */
    static IndexMetadata unavailable() {
        return (table, predicate) -> {
            double rows = CostModel.DEFAULT_TABLE_ROWS;
            if (predicate != null) {
                rows *= Math.pow(CostModel.DEFAULT_SELECTIVITY, Expressions.conjuncts(predicate).size());
            }
            return new CardinalityEstimate(CostModel.DEFAULT_TABLE_ROWS, rows, List.of());
        };
    }
}
