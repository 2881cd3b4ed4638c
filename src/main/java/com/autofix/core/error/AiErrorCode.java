package com.autofix.core.error;

/**
 * Errors raised by the analysis and fix stages.
 */
public enum AiErrorCode implements ErrorCode {
    ANALYSIS_FAILED,
    FIX_FAILED,
    CONTEXT_TOO_LARGE,
    API_ERROR,
    TOOL_NOT_FOUND(false),
    TIMEOUT,
    RATE_LIMIT,
    BUDGET_EXCEEDED(false),
    PARSE_ERROR;

    private final boolean retryable;

    AiErrorCode() {
        this(true);
    }

    AiErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    @Override
    public boolean retryable() {
        return retryable;
    }
}
