package org.saiql.engine.lang.ast;

import java.util.List;
import java.util.Objects;

/**
 * A read query: a relation, an optional ordering, a row limit and a sink.
 *
 * <p>SQL SELECT statements produce the same node with the {@link SinkFormat#ROWS} sink.
 *
 * @param source  relation being read
 * @param orderBy explicit ordering, possibly empty
 * @param limit   row limit (never null; {@link Limit#all()} for none)
 * @param sink    output format
 */
public record Pipeline(RelationAst source, List<OrderItem> orderBy, Limit limit, SinkFormat sink) implements QueryAst {

    public Pipeline {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(limit, "Limit cannot be null");
        Objects.requireNonNull(sink, "Sink cannot be null");
        orderBy = List.copyOf(orderBy);
    }

    @Override
    public <T> T accept(QueryAstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
