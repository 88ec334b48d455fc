package com.topostat.core.persistence;

/**
 * Dimension tables of the result schema, in resolution order.
 */
public enum DimensionType {
    DIRECTORY("directories"),
    MODULE("modules"),
    TEST("tests"),
    AGENT("agents"),
    PLAN("plans"),
    BUILD("builds"),
    JOB("jobs");

    private final String tableName;

    DimensionType(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
