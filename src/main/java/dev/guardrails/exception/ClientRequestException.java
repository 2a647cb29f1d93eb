package dev.guardrails.exception;

/**
 * 4xx from the analysis backend: the request itself is invalid, so it is not retried.
 */
public class ClientRequestException extends ScanBackendException {
    public ClientRequestException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
