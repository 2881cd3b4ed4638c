package com.autofix.core.model;

public enum Complexity {
    LOW,
    MEDIUM,
    HIGH
}
