package org.saiql.engine.lang.ast;

/**
 * Root of a parsed query: a read pipeline or a data modification statement.
 */
public sealed interface QueryAst permits Pipeline, Insert, Update, Delete {

    <T> T accept(QueryAstVisitor<T> visitor);
}
