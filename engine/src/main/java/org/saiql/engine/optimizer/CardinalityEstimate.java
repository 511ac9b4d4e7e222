package org.saiql.engine.optimizer;

import java.util.List;

/**
 * Row estimates for one table under a predicate.
 *
 * @param tableRows     rows in the table
 * @param estimatedRows rows expected to satisfy the predicate
 * @param indexes       indexes available on the table
 */
public record CardinalityEstimate(long tableRows, double estimatedRows, List<IndexDescriptor> indexes) {

    public CardinalityEstimate {
        if (tableRows < 0) {
            throw new IllegalArgumentException("Table rows cannot be negative: " + tableRows);
        }
        if (estimatedRows < 0 || Double.isNaN(estimatedRows)) {
            throw new IllegalArgumentException("Estimated rows must be a non-negative number: " + estimatedRows);
        }
        indexes = List.copyOf(indexes);
    }
}
