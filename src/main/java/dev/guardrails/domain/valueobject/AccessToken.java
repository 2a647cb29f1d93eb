package dev.guardrails.domain.valueobject;

import java.time.Duration;
import java.time.Instant;

/**
 * Short-lived installation token. {@code toString} never prints the value.
 */
public record AccessToken(String value, Instant expiresAt) {
    public AccessToken {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("token value required");
        if (expiresAt == null) throw new IllegalArgumentException("expiresAt required");
    }

    public boolean isUsableAt(Instant now, Duration refreshSkew) {
        return expiresAt.isAfter(now.plus(refreshSkew));
    }

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
