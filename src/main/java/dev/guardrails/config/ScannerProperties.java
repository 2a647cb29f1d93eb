package dev.guardrails.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Analysis backend connection and retry policy.
 *
 * <p>{@code endpointPaths} are equivalent scan endpoints tried in order within one attempt;
 * {@code maxAttempts} counts attempts, not HTTP calls.
 */
@ConfigurationProperties(prefix = "guardrails.scanner")
public record ScannerProperties(String baseUrl,
                                List<String> endpointPaths,
                                String healthPath,
                                Boolean healthCheckEnabled,
                                Duration healthTimeout,
                                int maxAttempts,
                                Duration initialBackoff,
                                double backoffMultiplier,
                                Duration maxBackoff,
                                Duration requestTimeout,
                                Duration connectTimeout,
                                Boolean detectAiGenerated) {
    public ScannerProperties {
        if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8000";
        if (endpointPaths == null || endpointPaths.isEmpty())
            endpointPaths = List.of("/scan", "/api/v1/scan/", "/api/v1/scan");
        else endpointPaths = List.copyOf(endpointPaths);
        if (healthPath == null || healthPath.isBlank()) healthPath = "/health";
        if (healthCheckEnabled == null) healthCheckEnabled = true;
        if (healthTimeout == null) healthTimeout = Duration.ofSeconds(5);
        if (maxAttempts <= 0) maxAttempts = 3;
        if (initialBackoff == null) initialBackoff = Duration.ofSeconds(1);
        if (backoffMultiplier < 1.0) backoffMultiplier = 2.0;
        if (maxBackoff == null) maxBackoff = Duration.ofSeconds(10);
        if (requestTimeout == null) requestTimeout = Duration.ofMinutes(5);
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
        if (detectAiGenerated == null) detectAiGenerated = true;
    }
}
