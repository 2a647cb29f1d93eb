package dev.guardrails.pipeline;

import dev.guardrails.config.GitHubProperties;
import dev.guardrails.domain.enums.CommitState;
import dev.guardrails.domain.valueobject.ChangedFile;
import dev.guardrails.domain.valueobject.PublicationReport;
import dev.guardrails.domain.valueobject.ScanOutcome;
import dev.guardrails.domain.valueobject.Violation;
import dev.guardrails.infrastructure.github.GitHubApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a scan outcome back to GitHub.
 *
 * <p>Pull requests get three independent sub-steps: a summary comment, one review
 * comment per anchored violation and a commit status on the head sha. A failing
 * sub-step is logged and the others still run; nothing here throws to the pipeline.
 */
@Component
public class ResultPublisher {
    private static final Logger log = LoggerFactory.getLogger(ResultPublisher.class);

    private final GitHubApiClient gitHubClient;
    private final FeedbackFormatter formatter;
    private final String statusContext;

    public ResultPublisher(GitHubApiClient gitHubClient, FeedbackFormatter formatter, GitHubProperties properties) {
        this.gitHubClient = gitHubClient;
        this.formatter = formatter;
        this.statusContext = properties.statusContext();
    }

    /**
     * {@code files} are the scanned files; their fetched content bounds the annotation lines.
     */
    public PublicationReport publishPullRequest(long installationId, String repo, int pr, String headSha,
                                                ScanOutcome outcome, List<ChangedFile> files) {
        boolean summaryPosted = postSummary(installationId, repo, pr, outcome);

        Map<String, Integer> lineCounts = lineCounts(files);
        int attempted = 0;
        int posted = 0;
        for (Map.Entry<String, List<Violation>> entry : groupByFile(outcome.result().violations()).entrySet()) {
            int lineCount = lineCounts.getOrDefault(entry.getKey(), 0);
            for (Violation violation : entry.getValue()) {
                attempted++;
                if (postAnnotation(installationId, repo, pr, headSha, violation, lineCount)) posted++;
            }
        }

        boolean statusSet = setStatus(installationId, repo, headSha, outcome);
        PublicationReport report = new PublicationReport(summaryPosted, attempted, posted, statusSet);
        if (report.isComplete()) {
            log.info("Published results on {}#{}: summary, {} annotation(s), status", repo, pr, posted);
        } else {
            log.warn("Partially published results on {}#{}: summary={}, annotations {}/{}, status={}",
                    repo, pr, summaryPosted, posted, attempted, statusSet);
        }
        return report;
    }

    /**
     * Pushes carry no conversation to comment on, so only the commit status is written.
     */
    public PublicationReport publishCommit(long installationId, String repo, String sha, ScanOutcome outcome) {
        boolean statusSet = setStatus(installationId, repo, sha, outcome);
        return new PublicationReport(false, 0, 0, statusSet);
    }

    private boolean postSummary(long installationId, String repo, int pr, ScanOutcome outcome) {
        try {
            gitHubClient.createIssueComment(repo, pr, formatter.summaryComment(outcome), installationId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to post summary comment on {}#{} (HTTP {}): {}",
                    repo, pr, httpStatus(e), e.getMessage());
            return false;
        }
    }

    private boolean postAnnotation(long installationId, String repo, int pr, String headSha,
                                   Violation violation, int lineCount) {
        int line = violation.anchorLine(lineCount);
        try {
            gitHubClient.createReviewComment(repo, pr, headSha, violation.filePath(), line,
                    formatter.violationComment(violation), installationId);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to annotate {}:{} with rule {} on {}#{} (HTTP {}): {}",
                    violation.filePath(), line, violation.ruleId(), repo, pr,
                    httpStatus(e), e.getMessage());
            return false;
        }
    }

    private boolean setStatus(long installationId, String repo, String sha, ScanOutcome outcome) {
        if (sha == null) {
            log.warn("No sha to set a commit status on for {}", repo);
            return false;
        }
        CommitState state = formatter.commitState(outcome);
        try {
            gitHubClient.createCommitStatus(repo, sha, state.wireValue(), formatter.statusDescription(outcome),
                    statusContext, installationId);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to set {} status on {}@{} (HTTP {}): {}",
                    state.wireValue(), repo, ContentFetcher.shortSha(sha), httpStatus(e), e.getMessage());
            return false;
        }
    }

    private static Map<String, List<Violation>> groupByFile(List<Violation> violations) {
        Map<String, List<Violation>> byFile = new LinkedHashMap<>();
        int skipped = 0;
        for (Violation violation : violations) {
            if (!violation.isAnchored()) {
                skipped++;
                continue;
            }
            byFile.computeIfAbsent(violation.filePath(), k -> new ArrayList<>()).add(violation);
        }
        if (skipped > 0) log.debug("Skipping {} violation(s) without a file path", skipped);
        return byFile;
    }

    private static Map<String, Integer> lineCounts(List<ChangedFile> files) {
        Map<String, Integer> counts = new HashMap<>();
        for (ChangedFile file : files) {
            if (file.hasFullContent()) counts.put(file.path(), file.lineCount());
        }
        return counts;
    }

    private static String httpStatus(RuntimeException e) {
        return e instanceof WebClientResponseException wcre ? String.valueOf(wcre.getStatusCode().value()) : "n/a";
    }
}
