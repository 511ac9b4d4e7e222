package org.saiql.engine.plan;

/**
 * Visitor for mutation nodes.
 *
 * @param <T> The return type
 */
public interface MutationNodeVisitor<T> {

    T visit(InsertNode insert);

    T visit(UpdateNode update);

    T visit(DeleteNode delete);
}
