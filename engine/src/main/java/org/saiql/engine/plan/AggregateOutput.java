package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;

/**
 * One output column of an {@link AggregateNode}: a grouping column or an
 * aggregate call.
 */
public sealed interface AggregateOutput permits Projection, AggregateCall {

    String alias();

    CanonicalType type();
}
