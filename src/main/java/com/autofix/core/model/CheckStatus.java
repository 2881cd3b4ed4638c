package com.autofix.core.model;

public enum CheckStatus {
    PASSED,
    FAILED,
    TIMEOUT,
    SKIPPED
}
