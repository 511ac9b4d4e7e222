package org.saiql.engine.lang.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output terminators of a symbolic pipeline ({@code >>oQ} and friends).
 */
public enum SinkFormat {
    /** Plain result rows. */
    ROWS("oQ"),
    /** A single JSON array built by the database. */
    JSON("oJ"),
    /** Rows rendered as a table by the caller. */
    TABLE("oT"),
    /** Rows rendered as CSV by the caller. */
    CSV("oC");

    private final String code;

    SinkFormat(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<SinkFormat> fromCode(String code) {
        return Arrays.stream(values()).filter(f -> f.code.equals(code)).findFirst();
    }
}
