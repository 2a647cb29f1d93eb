package dev.guardrails.exception;

/**
 * Deployment misconfiguration: malformed signing key, missing app id, unreadable key file.
 * Never retried.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
