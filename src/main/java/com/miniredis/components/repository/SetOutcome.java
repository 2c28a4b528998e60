package com.miniredis.components.repository;

public enum SetOutcome {
    CREATED,
    UPDATED,
    REJECTED;

    public boolean isApplied() {
        return this != REJECTED;
    }
}
