package com.miniredis.components.repository;

public enum SetMode {
    DEFAULT,
    ONLY_IF_ABSENT,
    ONLY_IF_PRESENT
}
