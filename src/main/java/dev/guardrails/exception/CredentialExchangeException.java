package dev.guardrails.exception;

/**
 * The identity provider refused or failed the installation lookup or token exchange.
 * Terminal for the current event.
 */
public class CredentialExchangeException extends RuntimeException {
    public CredentialExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
