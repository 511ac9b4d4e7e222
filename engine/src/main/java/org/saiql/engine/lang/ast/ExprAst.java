package org.saiql.engine.lang.ast;

/**
 * A scalar or boolean expression as written in the query.
 */
public sealed interface ExprAst permits Literal, ColumnRef, BinaryOp, Not, FunctionCall, IsNull, InList {

    <T> T accept(ExprAstVisitor<T> visitor);
}
