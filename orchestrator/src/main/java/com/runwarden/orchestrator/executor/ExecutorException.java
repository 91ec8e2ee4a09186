package com.runwarden.orchestrator.executor;

/**
 * Thrown when the sandbox executor returns an error, is unreachable, or
 * does not answer within the stage timeout.
 */
public class ExecutorException extends RuntimeException {

    private final boolean timeout;

    public ExecutorException(String message) {
        super(message);
        this.timeout = false;
    }

    public ExecutorException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public ExecutorException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() { return timeout; }
}
