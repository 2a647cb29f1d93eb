package dev.guardrails.exception;

/**
 * 5xx, timeout or connection failure: worth another attempt after backoff.
 */
public class TransientBackendException extends ScanBackendException {
    public TransientBackendException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
