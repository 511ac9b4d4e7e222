package org.saiql.engine.lang.ast;

/**
 * One entry of an aggregating select list: a plain column or an aggregate
 * call. Entries keep the order in which the query wrote them.
 */
public sealed interface SelectItem permits ColumnList.Item, AggregateCall {

    /**
     * Output name, or null to derive one.
     */
    String alias();
}
