package com.tony.baseballStats.service;

import java.util.List;

public record BatchReport(List<UnitOutcome> units) {

    public long count(UnitState state) {
        return units.stream().filter(u -> u.state() == state).count();
    }

    public long committed() { return count(UnitState.COMMITTED); }
    public long skipped() { return count(UnitState.SKIPPED); }
    public long failed() { return count(UnitState.FAILED); }

    public String summary() {
        return String.format("%d unités : %d chargées, %d ignorées, %d en échec",
                units.size(), committed(), skipped(), failed());
    }
}
