package org.saiql.engine.lang.ast;

import java.util.Objects;

public record OrderItem(ColumnRef column, boolean descending) {

    public OrderItem {
        Objects.requireNonNull(column, "Order column cannot be null");
    }
}
