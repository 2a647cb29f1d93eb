package dev.guardrails.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Violation severity as decided by the analysis engine. Unknown values map to UNKNOWN
 * so a new engine level never breaks publication.
 */
public enum Severity {
    CRITICAL("🔴"),
    HIGH("🟠"),
    MEDIUM("🟡"),
    LOW("🟢"),
    UNKNOWN("⚪");

    private final String marker;

    Severity(String marker) { this.marker = marker; }

    public String marker() { return marker; }

    @JsonValue
    public String wireValue() { return name().toLowerCase(); }

    @JsonCreator
    public static Severity fromWire(String value) {
        if (value == null) return UNKNOWN;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
