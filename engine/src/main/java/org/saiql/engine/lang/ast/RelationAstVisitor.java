package org.saiql.engine.lang.ast;

public interface RelationAstVisitor<T> {

    T visit(TableRef tableRef);

    T visit(Join join);

    T visit(Select select);

    T visit(Filter filter);

    T visit(Aggregate aggregate);
}
