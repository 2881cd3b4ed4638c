package com.autofix.core.error;

public enum OrchestratorErrorCode implements ErrorCode {
    MAX_RETRIES_EXCEEDED,
    COMMIT_FAILED,
    PUSH_FAILED,
    PR_CREATION_FAILED,
    INTERRUPTED(false),
    UNKNOWN;

    private final boolean retryable;

    OrchestratorErrorCode() {
        this(true);
    }

    OrchestratorErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    @Override
    public boolean retryable() {
        return retryable;
    }
}
