package dev.guardrails.domain.enums;

/**
 * Commit status states written back to GitHub.
 */
public enum CommitState {
    SUCCESS, FAILURE, ERROR;

    public String wireValue() { return name().toLowerCase(); }
}
