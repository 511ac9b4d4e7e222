package org.saiql.engine.plan;

import org.saiql.engine.lang.ast.SinkFormat;

import java.util.Objects;

/**
 * Top of every read plan: the output format of the rows below it.
 */
public record SinkNode(RelationNode source, SinkFormat format) implements RelationNode {

    public SinkNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(format, "Format cannot be null");
    }

    public SinkNode withSource(RelationNode value) {
        return new SinkNode(value, format);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
