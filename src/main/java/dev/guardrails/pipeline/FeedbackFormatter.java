package dev.guardrails.pipeline;

import dev.guardrails.domain.enums.CommitState;
import dev.guardrails.domain.valueobject.ScanOutcome;
import dev.guardrails.domain.valueobject.ScanResult;
import dev.guardrails.domain.valueobject.ScanSummary;
import dev.guardrails.domain.valueobject.Violation;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Renders scan outcomes as GitHub markdown and commit status fields.
 */
@Component
public class FeedbackFormatter {

    /** GitHub truncates status descriptions longer than this. */
    static final int MAX_STATUS_DESCRIPTION = 140;

    public String summaryComment(ScanOutcome outcome) {
        ScanResult result = outcome.result();
        StringBuilder sb = new StringBuilder();

        if (outcome.isDegraded()) {
            sb.append("## ⚠️ Guardrails Scan Incomplete\n\n");
            sb.append("The analysis service could not complete this scan, so no violations were reported.\n\n");
            sb.append("**Cause:** %s\n".formatted(outcome.cause()));
            if (outcome instanceof ScanOutcome.Degraded degraded) {
                sb.append("**Attempts:** %d\n".formatted(degraded.attempts()));
            }
            sb.append('\n');
            sb.append("### Enforcement Action\n");
            sb.append("**Mode:** %s\n".formatted(result.enforcementAction().name()));
            sb.append("**Can Merge:** %s\n\n".formatted(result.canMerge() ? "Yes" : "No"));
            sb.append("Push a new commit or re-run the scan once the service is back.\n");
            return sb.toString();
        }

        boolean passed = result.canMerge();
        ScanSummary.SeverityCounts counts = result.summary().bySeverity();
        sb.append("## %s Guardrails Scan %s\n\n".formatted(passed ? "✅" : "❌", passed ? "PASSED" : "FAILED"));
        sb.append("**Scan ID:** `%s`\n".formatted(result.scanId()));
        if (result.repository() != null) sb.append("**Repository:** %s\n".formatted(result.repository()));
        sb.append("**Processing Time:** %s ms\n".formatted(String.format(Locale.ROOT, "%.2f", result.processingTimeMs())));
        sb.append("**AI-Generated Code Detected:** %s\n\n".formatted(result.aiCodeDetected() ? "Yes" : "No"));

        sb.append("### Summary\n");
        sb.append("- **Total Violations:** %d\n".formatted(result.violations().size()));
        sb.append("- **Critical:** %d\n".formatted(counts.critical()));
        sb.append("- **High:** %d\n".formatted(counts.high()));
        sb.append("- **Medium:** %d\n".formatted(counts.medium()));
        sb.append("- **Low:** %d\n\n".formatted(counts.low()));

        sb.append("### Enforcement Action\n");
        sb.append("**Mode:** %s\n".formatted(result.enforcementAction().name()));
        sb.append("**Can Merge:** %s\n\n".formatted(passed ? "Yes" : "No"));

        sb.append(result.violations().isEmpty() ? "No violations found!\n" : "See inline comments for details.\n");
        return sb.toString();
    }

    public String violationComment(Violation violation) {
        StringBuilder sb = new StringBuilder();
        sb.append("%s **%s**: %s\n\n".formatted(violation.severity().marker(),
                violation.severity().wireValue().toUpperCase(Locale.ROOT),
                violation.ruleName() != null ? violation.ruleName() : violation.ruleId()));
        sb.append("**Rule ID:** `%s`\n".formatted(violation.ruleId()));
        if (violation.category() != null) sb.append("**Category:** %s\n".formatted(violation.category()));
        sb.append('\n');

        String explanation = violation.explanation() != null ? violation.explanation() : violation.message();
        if (explanation != null) sb.append(explanation).append("\n\n");

        if (violation.fixSuggestion() != null && !violation.fixSuggestion().isBlank()) {
            sb.append("**Suggested Fix:**\n```\n").append(violation.fixSuggestion()).append("\n```\n\n");
        }
        if (!violation.standardMappings().isEmpty()) {
            sb.append("**Standards:** %s\n".formatted(String.join(", ", violation.standardMappings())));
        }
        if (violation.aiGenerated()) {
            sb.append("\n⚠️ **AI-Generated Code Detected** - this violation was found in code likely produced by an AI assistant.\n");
        }
        return sb.toString();
    }

    public CommitState commitState(ScanOutcome outcome) {
        if (outcome.isDegraded()) return CommitState.ERROR;
        return outcome.result().canMerge() ? CommitState.SUCCESS : CommitState.FAILURE;
    }

    public String statusDescription(ScanOutcome outcome) {
        String description;
        if (outcome.isDegraded()) {
            description = "Scan could not complete: " + outcome.cause();
        } else {
            int count = outcome.result().violations().size();
            description = count == 0 ? "All checks passed" : count + " violation(s) found";
        }
        return description.length() <= MAX_STATUS_DESCRIPTION
                ? description
                : description.substring(0, MAX_STATUS_DESCRIPTION - 3) + "...";
    }
}
