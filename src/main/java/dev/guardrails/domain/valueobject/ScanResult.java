package dev.guardrails.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.guardrails.domain.enums.EnforcementMode;

import java.util.List;
import java.util.UUID;

/**
 * Analysis result as returned by the backend. Only the fields needed to render
 * feedback are modelled; {@code error} is the backend's failure marker, and is also set
 * on locally produced degraded results.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScanResult(
        @JsonProperty("scan_id") String scanId,
        String repository,
        List<Violation> violations,
        ScanSummary summary,
        @JsonProperty("enforcement_action") EnforcementMode enforcementAction,
        @JsonProperty("can_merge") Boolean canMerge,
        @JsonProperty("copilot_detected") Boolean aiCodeDetected,
        @JsonProperty("processing_time_ms") Double processingTimeMs,
        String error
) {
    public ScanResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        if (summary == null) summary = ScanSummary.of(violations);
        if (enforcementAction == null) enforcementAction = EnforcementMode.ADVISORY;
        // An answer without a merge decision must not block.
        if (canMerge == null) canMerge = true;
        if (aiCodeDetected == null) aiCodeDetected = false;
        if (processingTimeMs == null) processingTimeMs = 0.0;
    }

    /**
     * Result for an event with nothing to scan. The backend is never called.
     */
    public static ScanResult clean(String repository) {
        return new ScanResult("skipped-" + UUID.randomUUID(), repository, List.of(), ScanSummary.EMPTY,
                EnforcementMode.ADVISORY, true, false, 0.0, null);
    }

    /**
     * Non-blocking stand-in used when the backend could not produce a result.
     */
    public static ScanResult degraded(String repository, String cause, double elapsedMs) {
        return new ScanResult("degraded-" + UUID.randomUUID(), repository, List.of(), ScanSummary.EMPTY,
                EnforcementMode.ADVISORY, true, false, elapsedMs,
                cause != null ? cause : "analysis backend unavailable");
    }

    public boolean isError() {
        return error != null;
    }
}
