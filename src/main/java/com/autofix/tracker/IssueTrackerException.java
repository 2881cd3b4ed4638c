package com.autofix.tracker;

/**
 * Raised when issues cannot be fetched from the tracker.
 */
public class IssueTrackerException extends RuntimeException {

    public IssueTrackerException(String message) {
        super(message);
    }

    public IssueTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
