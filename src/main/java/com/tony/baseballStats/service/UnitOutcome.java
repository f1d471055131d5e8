package com.tony.baseballStats.service;

public record UnitOutcome(String sourceToken, UnitState state, String detail,
                          int batterRows, int pitcherRows, boolean archived) {

    public static UnitOutcome skipped(String sourceToken, String reason, boolean archived) {
        return new UnitOutcome(sourceToken, UnitState.SKIPPED, reason, 0, 0, archived);
    }

    public static UnitOutcome failed(String sourceToken, String reason) {
        return new UnitOutcome(sourceToken, UnitState.FAILED, reason, 0, 0, false);
    }

    public static UnitOutcome committed(String sourceToken, int batterRows, int pitcherRows, boolean archived) {
        return new UnitOutcome(sourceToken, UnitState.COMMITTED, null, batterRows, pitcherRows, archived);
    }
}
