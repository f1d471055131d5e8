package com.tony.baseballStats.model;

public enum StatKind {
    BATTER("batter_stats"),
    PITCHER("pitcher_stats");

    private final String table;

    StatKind(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
