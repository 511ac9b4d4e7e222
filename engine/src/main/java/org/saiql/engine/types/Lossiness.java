package org.saiql.engine.types;

import java.util.Objects;

/**
 * Outcome of a type conversion check.
 *
 * @param lossy  whether some values cannot survive the conversion unchanged
 * @param reason why, required when lossy
 */
public record Lossiness(boolean lossy, String reason) {

    public static final Lossiness NONE = new Lossiness(false, null);

    public Lossiness {
        if (lossy && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("A lossy conversion requires a reason");
        }
        if (!lossy && reason != null) {
            throw new IllegalArgumentException("A lossless conversion carries no reason");
        }
    }

    public static Lossiness lossy(String reason) {
        return new Lossiness(true, Objects.requireNonNull(reason, "Reason cannot be null"));
    }

    /**
     * Combines two outcomes; reasons are joined in order.
     */
    public Lossiness and(Lossiness other) {
        if (!lossy) {
            return other;
        }
        if (!other.lossy) {
            return this;
        }
        return lossy(reason + "; " + other.reason);
    }
}
