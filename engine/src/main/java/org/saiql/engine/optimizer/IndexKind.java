package org.saiql.engine.optimizer;

public enum IndexKind {
    /** Serves equality and range predicates on its leading column. */
    BTREE,
    /** Serves equality predicates only. */
    HASH
}
