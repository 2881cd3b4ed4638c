package com.autofix.core.model;

public enum GroupStatus {
    COMPLETED,
    FAILED
}
