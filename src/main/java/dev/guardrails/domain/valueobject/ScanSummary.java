package dev.guardrails.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.guardrails.domain.enums.Severity;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Aggregate counts reported with a scan result.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScanSummary(
        @JsonProperty("total_violations") Integer totalViolations,
        @JsonProperty("by_severity") SeverityCounts bySeverity,
        @JsonProperty("by_category") Map<String, Integer> byCategory,
        @JsonProperty("copilot_violations") Integer aiGeneratedViolations,
        @JsonProperty("files_affected") Integer filesAffected
) {
    public ScanSummary {
        if (totalViolations == null) totalViolations = 0;
        if (bySeverity == null) bySeverity = SeverityCounts.NONE;
        if (aiGeneratedViolations == null) aiGeneratedViolations = 0;
        if (filesAffected == null) filesAffected = 0;
        byCategory = byCategory == null ? Map.of() : Map.copyOf(byCategory);
    }

    public static final ScanSummary EMPTY = new ScanSummary(0, SeverityCounts.NONE, Map.of(), 0, 0);

    public static ScanSummary of(List<Violation> violations) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        Map<String, Integer> categories = new TreeMap<>();
        Set<String> files = new HashSet<>();
        int aiGenerated = 0;
        for (Violation v : violations) {
            counts.merge(v.severity(), 1, Integer::sum);
            if (v.category() != null) categories.merge(v.category(), 1, Integer::sum);
            if (v.isAnchored()) files.add(v.filePath());
            if (v.aiGenerated()) aiGenerated++;
        }
        SeverityCounts bySeverity = new SeverityCounts(
                counts.getOrDefault(Severity.CRITICAL, 0),
                counts.getOrDefault(Severity.HIGH, 0),
                counts.getOrDefault(Severity.MEDIUM, 0),
                counts.getOrDefault(Severity.LOW, 0));
        return new ScanSummary(violations.size(), bySeverity, categories, aiGenerated, files.size());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeverityCounts(Integer critical, Integer high, Integer medium, Integer low) {
        public static final SeverityCounts NONE = new SeverityCounts(0, 0, 0, 0);

        public SeverityCounts {
            if (critical == null) critical = 0;
            if (high == null) high = 0;
            if (medium == null) medium = 0;
            if (low == null) low = 0;
        }
    }
}
