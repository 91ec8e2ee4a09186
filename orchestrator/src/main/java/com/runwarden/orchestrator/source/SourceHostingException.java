package com.runwarden.orchestrator.source;

/**
 * Thrown when the source host cannot be reached or the pull request URL
 * cannot be understood.
 */
public class SourceHostingException extends RuntimeException {

    public SourceHostingException(String message) {
        super(message);
    }

    public SourceHostingException(String message, Throwable cause) {
        super(message, cause);
    }
}
