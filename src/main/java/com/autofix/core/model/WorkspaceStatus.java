package com.autofix.core.model;

public enum WorkspaceStatus {
    CREATING,
    READY,
    IN_USE,
    CLEANING,
    REMOVED
}
