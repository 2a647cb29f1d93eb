package dev.guardrails.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.guardrails.domain.enums.Severity;

import java.util.List;

/**
 * A single issue flagged by the analysis engine, anchored to a file and line.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Violation(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("rule_name") String ruleName,
        String category,
        Severity severity,
        @JsonProperty("file_path") String filePath,
        @JsonProperty("line_number") Integer lineNumber,
        String message,
        String explanation,
        @JsonProperty("fix_suggestion") String fixSuggestion,
        @JsonProperty("standard_mappings") List<String> standardMappings,
        @JsonProperty("is_copilot_generated") Boolean aiGenerated,
        @JsonProperty("ai_confidence") Double aiConfidence
) {
    public Violation {
        if (severity == null) severity = Severity.UNKNOWN;
        if (lineNumber == null) lineNumber = 0;
        if (aiGenerated == null) aiGenerated = false;
        standardMappings = standardMappings == null ? List.of() : List.copyOf(standardMappings);
    }

    public boolean isAnchored() {
        return filePath != null && !filePath.isBlank();
    }

    /**
     * Line a review comment can be anchored on. GitHub rejects lines below 1 and past the
     * end of the file; a {@code lineCount} of 0 means the file length is unknown.
     */
    public int anchorLine(int lineCount) {
        int line = Math.max(1, lineNumber);
        return lineCount > 0 ? Math.min(line, lineCount) : line;
    }
}
