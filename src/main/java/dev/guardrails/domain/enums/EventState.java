package dev.guardrails.domain.enums;

/**
 * Lifecycle of one delivery:
 * RECEIVED → AUTHENTICATED → CONTENT_GATHERED → SCANNED → PUBLISHED | DEGRADED_PUBLISHED.
 * REJECTED only follows RECEIVED; IGNORED and FAILED end the event before publication.
 * Transitions only move to a higher stage and terminal states admit none.
 */
public enum EventState {
    RECEIVED(0, false),
    AUTHENTICATED(1, false),
    CONTENT_GATHERED(2, false),
    SCANNED(3, false),
    PUBLISHED(4, true),
    DEGRADED_PUBLISHED(4, true),
    REJECTED(4, true),
    IGNORED(4, true),
    FAILED(4, true);

    private final int stage;
    private final boolean terminal;

    EventState(int stage, boolean terminal) {
        this.stage = stage;
        this.terminal = terminal;
    }

    public boolean isTerminal() { return terminal; }

    public boolean canAdvanceTo(EventState next) {
        if (isTerminal() || next == null) return false;
        if (next == REJECTED) return this == RECEIVED;
        return next.stage > this.stage;
    }

    public String label() {
        return name().toLowerCase().replace('_', '-');
    }
}
