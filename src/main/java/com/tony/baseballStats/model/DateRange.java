package com.tony.baseballStats.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Intervalle de dates fermé [start, end].
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Intervalle inversé : " + start + " > " + end);
        }
    }

    /**
     * [s1,e1] et [s2,e2] se chevauchent ssi s1 <= e2 ET s2 <= e1 (bornes incluses).
     */
    public boolean overlaps(DateRange other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    @Override
    public String toString() {
        return start + " → " + end;
    }
}
