package org.saiql.engine.lang.ast;

import java.util.Objects;

/**
 * Row limit of a pipeline. Numeric and named limits share this one value.
 *
 * @param kind   limit kind
 * @param rows   row count for {@link Kind#ROWS}, otherwise null
 * @param offset rows to skip, or null
 */
public record Limit(Kind kind, Long rows, Long offset) {

    public enum Kind {
        /** A fixed number of rows. */
        ROWS,
        /** No limit. */
        ALL,
        /** The first row of the ordering. */
        FIRST,
        /** The last row of the ordering. */
        LAST,
        /** One row chosen at random. */
        RANDOM
    }

    public Limit {
        Objects.requireNonNull(kind, "Limit kind cannot be null");
        if (kind == Kind.ROWS && (rows == null || rows < 0)) {
            throw new IllegalArgumentException("Row limit must be a non-negative count");
        }
        if (kind != Kind.ROWS && rows != null) {
            throw new IllegalArgumentException("Only ROWS limits carry a count");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative");
        }
    }

    public static Limit all() {
        return new Limit(Kind.ALL, null, null);
    }

    public static Limit rows(long rows) {
        return new Limit(Kind.ROWS, rows, null);
    }

    public static Limit of(Kind kind) {
        return new Limit(kind, null, null);
    }

    public Limit withOffset(long offset) {
        return new Limit(kind, rows, offset);
    }
}
