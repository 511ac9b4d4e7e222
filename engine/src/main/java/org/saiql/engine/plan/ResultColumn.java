package org.saiql.engine.plan;

import org.saiql.engine.types.CanonicalType;

import java.util.Objects;

/**
 * A column of a read query's result.
 */
public record ResultColumn(String name, CanonicalType type) {

    public ResultColumn {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
    }
}
