package org.saiql.engine.plan;

import java.util.Objects;

/**
 * How a scan reads its table.
 *
 * @param kind          full scan or index lookup
 * @param indexName     chosen index, null for a full scan
 * @param estimatedRows estimated rows read, or null before costing
 * @param cost          estimated cost, or null before costing
 */
public record AccessPath(Kind kind, String indexName, Double estimatedRows, Double cost) {

    public enum Kind {
        FULL_SCAN,
        INDEX_LOOKUP
    }

    private static final AccessPath UNCOSTED = new AccessPath(Kind.FULL_SCAN, null, null, null);

    public AccessPath {
        Objects.requireNonNull(kind, "Access path kind cannot be null");
        if (kind == Kind.INDEX_LOOKUP && indexName == null) {
            throw new IllegalArgumentException("Index lookup requires an index name");
        }
        if (kind == Kind.FULL_SCAN && indexName != null) {
            throw new IllegalArgumentException("Full scan cannot name an index");
        }
    }

    /**
     * Full scan assigned by the validator, before any costing.
     */
    public static AccessPath uncosted() {
        return UNCOSTED;
    }

    public static AccessPath fullScan(double rows, double cost) {
        return new AccessPath(Kind.FULL_SCAN, null, rows, cost);
    }

    public static AccessPath indexLookup(String indexName, double rows, double cost) {
        return new AccessPath(Kind.INDEX_LOOKUP, indexName, rows, cost);
    }

    public String describe() {
        return kind == Kind.FULL_SCAN ? "full scan" : "index " + indexName;
    }
}
