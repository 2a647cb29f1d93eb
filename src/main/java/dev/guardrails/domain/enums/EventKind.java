package dev.guardrails.domain.enums;

/**
 * Repository event kinds, from the X-GitHub-Event header.
 */
public enum EventKind {
    PULL_REQUEST("pull_request"),
    PUSH("push"),
    REVIEW("pull_request_review"),
    OTHER("other");

    private final String header;

    EventKind(String header) { this.header = header; }

    public String header() { return header; }

    public static EventKind fromHeader(String value) {
        if (value == null) return OTHER;
        for (EventKind kind : values()) {
            if (kind.header.equals(value)) return kind;
        }
        return OTHER;
    }
}
