package com.autofix.core.model;

/**
 * Priority levels, declared from most to least urgent.
 */
public enum IssuePriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public boolean isHigherThan(IssuePriority other) {
        return ordinal() < other.ordinal();
    }
}
