package com.autofix.core.error;

import java.util.Map;

/**
 * Error channel of every stage result.
 *
 * @param code    taxonomy code
 * @param message human-readable message
 * @param details structured extras (e.g. forbidden-pattern matches), never null
 * @param cause   underlying exception, may be null
 */
public record StageError(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {

    public StageError {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static StageError of(ErrorCode code, String message) {
        return new StageError(code, message, Map.of(), null);
    }

    public static StageError of(ErrorCode code, String message, Throwable cause) {
        return new StageError(code, message, Map.of(), cause);
    }

    public boolean retryable() {
        return code.retryable();
    }

    @Override
    public String toString() {
        return code.name() + ": " + message;
    }
}
