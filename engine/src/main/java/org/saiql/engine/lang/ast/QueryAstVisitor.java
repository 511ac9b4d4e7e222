package org.saiql.engine.lang.ast;

public interface QueryAstVisitor<T> {

    T visit(Pipeline pipeline);

    T visit(Insert insert);

    T visit(Update update);

    T visit(Delete delete);
}
