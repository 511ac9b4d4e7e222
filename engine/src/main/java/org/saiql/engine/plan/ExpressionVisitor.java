package org.saiql.engine.plan;

/**
 * Visitor interface for traversing Expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitColumnReference(ColumnReference columnRef);

    T visitLiteral(Literal literal);

    T visitComparison(ComparisonExpression comparison);

    T visitLogical(LogicalExpression logical);

    T visitIsNull(IsNullExpression isNull);

    T visitIn(InExpression in);

    T visitFunctionCall(SqlFunctionCall functionCall);
}
