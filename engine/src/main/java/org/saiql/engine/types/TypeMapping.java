package org.saiql.engine.types;

import org.saiql.engine.DialectId;

import java.util.Objects;

/**
 * Result of mapping one column type onto a target dialect.
 *
 * @param sourceDialect   dialect the source signature belongs to, or null
 *                        when mapping a canonical type directly
 * @param sourceSignature source type as written (or the canonical signature)
 * @param canonical       canonical form of the source type
 * @param targetDialect   target dialect
 * @param targetSignature target type as it appears in target DDL
 * @param targetCanonical what the target type can actually hold
 * @param lossy           whether values may change on the way
 * @param reason          why the mapping is lossy; required when lossy
 */
public record TypeMapping(
        DialectId sourceDialect,
        String sourceSignature,
        CanonicalType canonical,
        DialectId targetDialect,
        String targetSignature,
        CanonicalType targetCanonical,
        boolean lossy,
        String reason
) {

    public TypeMapping {
        Objects.requireNonNull(sourceSignature, "Source signature cannot be null");
        Objects.requireNonNull(canonical, "Canonical type cannot be null");
        Objects.requireNonNull(targetDialect, "Target dialect cannot be null");
        Objects.requireNonNull(targetSignature, "Target signature cannot be null");
        Objects.requireNonNull(targetCanonical, "Target canonical type cannot be null");
        if (lossy && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("Lossy mapping of " + sourceSignature + " requires a reason");
        }
    }

    public Lossiness lossiness() {
        return lossy ? Lossiness.lossy(reason) : Lossiness.NONE;
    }

    @Override
    public String toString() {
        return sourceSignature + " -> " + targetSignature + (lossy ? " (lossy: " + reason + ")" : "");
    }
}
