package org.saiql.engine.plan;

/**
 * Root of the intermediate representation produced by the validator.
 *
 * <p>Read queries are {@link RelationNode} trees topped by a {@link SinkNode};
 * data modification statements are {@link MutationNode}s. Nodes are immutable
 * records: rewrites build new trees.
 */
public sealed interface PlanNode permits RelationNode, MutationNode {
}
