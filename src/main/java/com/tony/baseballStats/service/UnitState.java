package com.tony.baseballStats.service;

/**
 * DISCOVERED -> RANGE_CHECKED -> {SKIPPED | LOADING} -> {COMMITTED | FAILED}
 */
public enum UnitState {
    DISCOVERED,
    RANGE_CHECKED,
    SKIPPED,
    LOADING,
    COMMITTED,
    FAILED
}
