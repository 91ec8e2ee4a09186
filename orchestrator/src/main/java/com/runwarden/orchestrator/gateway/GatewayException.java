package com.runwarden.orchestrator.gateway;

/**
 * Thrown when a call to the remote agent API fails.
 *
 * TRANSIENT covers network errors, timeouts, 408/429 and 5xx: the poller
 * simply tries again on its next tick. REJECTED covers every other 4xx: the
 * remote side refused the request and retrying it unchanged will not help.
 */
public class GatewayException extends RuntimeException {

    public enum Kind { TRANSIENT, REJECTED }

    private final Kind kind;
    private final int  statusCode;

    public GatewayException(Kind kind, int statusCode, String message) {
        super(message);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public GatewayException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind       = kind;
        this.statusCode = 0;
    }

    /** Classify an HTTP status the remote API answered with. */
    public static GatewayException forStatus(int statusCode, String operation, String body) {
        Kind kind = (statusCode == 408 || statusCode == 429 || statusCode >= 500)
                ? Kind.TRANSIENT
                : Kind.REJECTED;
        return new GatewayException(kind, statusCode,
                "%s failed with HTTP %d: %s".formatted(operation, statusCode, body));
    }

    public Kind getKind()        { return kind; }
    public int  getStatusCode()  { return statusCode; }
    public boolean isTransient() { return kind == Kind.TRANSIENT; }
}
