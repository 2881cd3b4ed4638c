package com.autofix.core.process;

/**
 * Thrown when a subprocess cannot be started or waited on.
 */
public class ProcessExecutionException extends RuntimeException {

    public ProcessExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
