package dev.guardrails.exception;

/**
 * Failure talking to the analysis backend. Never escapes the scan client:
 * it is converted into a degraded scan outcome.
 */
public abstract class ScanBackendException extends RuntimeException {
    private final int statusCode;

    protected ScanBackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failing response, or 0 for connection-level failures. */
    public int statusCode() {
        return statusCode;
    }

    public abstract boolean isRetryable();
}
