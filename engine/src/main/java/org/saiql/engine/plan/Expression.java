package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;

/**
 * Sealed interface representing resolved expressions in the IR.
 *
 * <p>Every column reference is bound to a scan alias and a catalog column;
 * every literal carries the canonical type it is compared or assigned to.
 */
public sealed interface Expression
        permits ColumnReference, Literal, ComparisonExpression, LogicalExpression,
        IsNullExpression, InExpression, SqlFunctionCall {

    <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * Canonical type of the expression's value.
     */
    CanonicalType type();
}
