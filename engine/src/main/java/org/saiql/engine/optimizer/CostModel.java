package org.saiql.engine.optimizer;

/**
 * Unit costs shared by the access path and join order rules.
 */
public final class CostModel {

    public static final long DEFAULT_TABLE_ROWS = 1000;
    public static final double DEFAULT_SELECTIVITY = 0.1;

    static final double SCAN_COST_PER_ROW = 0.01;
    static final double INDEX_PROBE_COST = 0.01;
    static final double INDEX_ROW_COST = 0.03;
    static final double JOIN_COST_PER_ROW = 0.02;

    private CostModel() {
    }

    public static double fullScanCost(long tableRows) {
        return tableRows * SCAN_COST_PER_ROW;
    }

    /**
     * B-tree/hash descent plus one random read per matched row.
     */
    public static double indexLookupCost(long tableRows, double matchedRows) {
        double depth = Math.log(Math.max(tableRows, 2)) / Math.log(2);
        return depth * INDEX_PROBE_COST + matchedRows * INDEX_ROW_COST;
    }

    /**
     * Rows out of joining two inputs.
     */
    public static double joinRows(double leftRows, double rightRows, boolean connected) {
        return leftRows * rightRows * (connected ? DEFAULT_SELECTIVITY : 1.0);
    }

    public static double joinCost(double leftRows, double rightRows) {
        return (leftRows + rightRows) * JOIN_COST_PER_ROW;
    }
}
