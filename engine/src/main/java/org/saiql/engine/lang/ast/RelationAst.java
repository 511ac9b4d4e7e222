package org.saiql.engine.lang.ast;

/**
 * A relation-producing AST node. Each variant owns exactly its children.
 */
public sealed interface RelationAst permits TableRef, Join, Select, Filter, Aggregate {

    <T> T accept(RelationAstVisitor<T> visitor);
}
