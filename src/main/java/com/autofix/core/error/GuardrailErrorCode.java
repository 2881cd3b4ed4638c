package com.autofix.core.error;

/**
 * Guardrail rejections are structural, so none of them are retried.
 */
public enum GuardrailErrorCode implements ErrorCode {
    FORBIDDEN_PATTERN_DETECTED,
    SCOPE_TOO_BROAD;

    @Override
    public boolean retryable() {
        return false;
    }
}
