package org.saiql.engine.lang.ast;

public interface ExprAstVisitor<T> {

    T visit(Literal literal);

    T visit(ColumnRef columnRef);

    T visit(BinaryOp binaryOp);

    T visit(Not not);

    T visit(FunctionCall functionCall);

    T visit(IsNull isNull);

    T visit(InList inList);
}
