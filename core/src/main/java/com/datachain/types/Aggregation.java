package com.datachain.types;

/**
 * Aggregation functions available to measures and KPIs.
 */
public enum Aggregation {
    SUM("SUM"),
    AVG("AVG"),
    COUNT("COUNT"),
    COUNT_DISTINCT("COUNT"),
    MIN("MIN"),
    MAX("MAX"),
    MEDIAN("MEDIAN");

    private final String functionName;

    Aggregation(String functionName) {
        this.functionName = functionName;
    }

    /**
     * Returns the DuckDB function name for this aggregation.
     *
     * <p>COUNT_DISTINCT shares the COUNT function and is distinguished by a
     * DISTINCT modifier at render time.
     *
     * @return the SQL function name
     */
    public String functionName() {
        return functionName;
    }

    public boolean isDistinct() {
        return this == COUNT_DISTINCT;
    }

    /**
     * Returns true if the aggregation is only meaningful over numeric input.
     *
     * @return true for SUM and AVG
     */
    public boolean requiresNumeric() {
        return this == SUM || this == AVG;
    }
}
