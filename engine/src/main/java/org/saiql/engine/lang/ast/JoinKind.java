package org.saiql.engine.lang.ast;

public enum JoinKind {
    INNER, LEFT, RIGHT, FULL, CROSS
}
