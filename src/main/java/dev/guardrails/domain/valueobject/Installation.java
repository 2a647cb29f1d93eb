package dev.guardrails.domain.valueobject;

/**
 * A GitHub App installation: the grant of the app's permissions on a repository or account.
 */
public record Installation(long id, String scope) {}
