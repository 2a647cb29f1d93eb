package dev.guardrails.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Policy enforcement decided by the analysis engine and rendered here.
 * ADVISORY is the default whenever the engine gave no usable answer.
 */
public enum EnforcementMode {
    ADVISORY, WARNING, BLOCKING;

    @JsonValue
    public String wireValue() { return name().toLowerCase(); }

    @JsonCreator
    public static EnforcementMode fromWire(String value) {
        if (value == null) return ADVISORY;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return ADVISORY;
        }
    }
}
