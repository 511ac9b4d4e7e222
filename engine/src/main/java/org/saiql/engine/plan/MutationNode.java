package org.saiql.engine.plan;

import org.saiql.engine.store.Table;

/**
 * Sealed interface for data modification statements (INSERT, UPDATE, DELETE).
 */
public sealed interface MutationNode extends PlanNode permits InsertNode, UpdateNode, DeleteNode {

    /**
     * @return The target table
     */
    Table table();

    <T> T accept(MutationNodeVisitor<T> visitor);
}
