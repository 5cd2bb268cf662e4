package com.devflow.orchestrator.tracker;

/**
 * Thrown when the issue tracker returns a non-2xx status or cannot be reached.
 * Status 0 means no response was received.
 */
public class IssueTrackerException extends RuntimeException {

    private final int statusCode;

    public IssueTrackerException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public IssueTrackerException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() { return statusCode; }
}
