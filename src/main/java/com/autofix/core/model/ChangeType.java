package com.autofix.core.model;

public enum ChangeType {
    ADDED,
    MODIFIED,
    DELETED
}
