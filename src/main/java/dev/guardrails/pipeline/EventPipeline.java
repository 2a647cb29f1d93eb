package dev.guardrails.pipeline;

import dev.guardrails.config.ScannerProperties;
import dev.guardrails.domain.enums.EventKind;
import dev.guardrails.domain.enums.EventState;
import dev.guardrails.domain.valueobject.ChangedFile;
import dev.guardrails.domain.valueobject.EventOutcome;
import dev.guardrails.domain.valueobject.InboundEvent;
import dev.guardrails.domain.valueobject.Installation;
import dev.guardrails.domain.valueobject.PublicationReport;
import dev.guardrails.domain.valueobject.ScanOutcome;
import dev.guardrails.domain.valueobject.ScanRequest;
import dev.guardrails.domain.valueobject.ScanResult;
import dev.guardrails.exception.ConfigurationException;
import dev.guardrails.exception.CredentialExchangeException;
import dev.guardrails.infrastructure.github.CredentialBroker;
import dev.guardrails.infrastructure.github.GitHubApiClient;
import dev.guardrails.infrastructure.scanner.ScanClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one actionable delivery end to end.
 *
 * <pre>
 *  1. Resolve the installation and obtain an installation token
 *  2. Gather changed files (pull request head, or each pushed commit)
 *  3. Scan (skipped when nothing changed)
 *  4. Publish summary, annotations and commit status
 * </pre>
 *
 * <p>Returns the terminal {@link EventOutcome}; never throws. Credential and
 * configuration failures end the event in {@code failed}. A push's commits are handled
 * one after another and a failing commit does not stop the rest.
 */
@Component
public class EventPipeline {
    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    private final CredentialBroker credentialBroker;
    private final GitHubApiClient gitHubClient;
    private final ContentFetcher contentFetcher;
    private final ScanClient scanClient;
    private final ResultPublisher publisher;
    private final boolean detectAiGenerated;
    private final MeterRegistry meterRegistry;

    public EventPipeline(CredentialBroker credentialBroker,
                         GitHubApiClient gitHubClient,
                         ContentFetcher contentFetcher,
                         ScanClient scanClient,
                         ResultPublisher publisher,
                         ScannerProperties scannerProperties,
                         MeterRegistry meterRegistry) {
        this.credentialBroker = credentialBroker;
        this.gitHubClient = gitHubClient;
        this.contentFetcher = contentFetcher;
        this.scanClient = scanClient;
        this.publisher = publisher;
        this.detectAiGenerated = scannerProperties.detectAiGenerated();
        this.meterRegistry = meterRegistry;
    }

    public EventOutcome process(InboundEvent event) {
        Timer.Sample sample = Timer.start(meterRegistry);
        EventLifecycle lifecycle = new EventLifecycle(event.deliveryId());
        EventOutcome outcome;

        try (MDC.MDCCloseable delivery = MDC.putCloseable("deliveryId", event.deliveryId());
             MDC.MDCCloseable repository = MDC.putCloseable("repository", event.repository())) {
            outcome = run(event, lifecycle);
        }

        sample.stop(Timer.builder("guardrails.event.duration")
                .description("End-to-end processing time of one delivery")
                .tag("kind", event.kind().header())
                .tag("state", outcome.state().label())
                .register(meterRegistry));
        return outcome;
    }

    private EventOutcome run(InboundEvent event, EventLifecycle lifecycle) {
        long installationId;
        try {
            installationId = authenticate(event);
        } catch (CredentialExchangeException | ConfigurationException e) {
            log.error("Credential step failed for {} on {}: {}", event.deliveryId(), event.repository(), e.getMessage());
            lifecycle.advance(EventState.FAILED);
            return EventOutcome.failed(event.deliveryId(), "credential exchange failed: " + e.getMessage());
        }
        lifecycle.advance(EventState.AUTHENTICATED);

        try {
            if (event.kind() == EventKind.PULL_REQUEST) return pullRequest(event, installationId, lifecycle);
            if (event.kind() == EventKind.PUSH) return push(event, installationId, lifecycle);
            lifecycle.advance(EventState.IGNORED);
            return EventOutcome.ignored(event.deliveryId(), "event kind " + event.kind().header() + " not handled");
        } catch (RuntimeException e) {
            log.error("Delivery {} failed in state {}: {}", event.deliveryId(), lifecycle.state().label(),
                    e.getMessage(), e);
            lifecycle.advance(EventState.FAILED);
            return EventOutcome.failed(event.deliveryId(), e.getMessage());
        }
    }

    private long authenticate(InboundEvent event) {
        Installation installation = event.installationId() != null
                ? new Installation(event.installationId(), event.repository())
                : credentialBroker.resolveInstallation(event.repository());
        credentialBroker.tokenFor(installation);
        return installation.id();
    }

    private EventOutcome pullRequest(InboundEvent event, long installationId, EventLifecycle lifecycle) {
        String repo = event.repository();
        int pr = event.pullRequestNumber();
        String headSha = event.headSha() != null
                ? event.headSha()
                : gitHubClient.getPullRequestHeadSha(repo, pr, installationId);

        List<ChangedFile> files = contentFetcher.pullRequestFiles(repo, pr, headSha, installationId);
        lifecycle.advance(EventState.CONTENT_GATHERED);

        ScanOutcome scan = scanOrSkip(ScanRequest.forPullRequest(repo, pr, files, detectAiGenerated));
        lifecycle.advance(EventState.SCANNED);

        PublicationReport report = publisher.publishPullRequest(installationId, repo, pr, headSha, scan, files);
        EventState terminal = scan.isDegraded() ? EventState.DEGRADED_PUBLISHED : EventState.PUBLISHED;
        lifecycle.advance(terminal);

        ScanResult result = scan.result();
        List<String> notes = new ArrayList<>();
        if (scan.isDegraded()) notes.add(scan.cause());
        if (!report.isComplete()) {
            notes.add("publication incomplete: summary=%s, annotations %d/%d, status=%s".formatted(
                    report.summaryPosted(), report.annotationsPosted(), report.annotationsAttempted(),
                    report.statusSet()));
        }
        log.info("PR {}#{} finished as {}: {} violation(s), mergeable={}",
                repo, pr, terminal.label(), result.violations().size(), result.canMerge());
        return new EventOutcome(event.deliveryId(), terminal, "pull request #" + pr,
                result.violations().size(), result.canMerge(), notes);
    }

    private EventOutcome push(InboundEvent event, long installationId, EventLifecycle lifecycle) {
        String repo = event.repository();
        List<String> notes = new ArrayList<>();
        int succeeded = 0;
        int violations = 0;
        boolean mergeable = true;
        boolean degraded = false;

        for (String sha : event.commitShas()) {
            String shortSha = ContentFetcher.shortSha(sha);
            try {
                List<ChangedFile> files = contentFetcher.commitFiles(repo, sha, installationId);
                ScanOutcome scan = scanOrSkip(ScanRequest.forCommit(repo, sha, files, detectAiGenerated));
                PublicationReport report = publisher.publishCommit(installationId, repo, sha, scan);

                succeeded++;
                violations += scan.result().violations().size();
                mergeable &= scan.result().canMerge();
                degraded |= scan.isDegraded();
                notes.add(shortSha + ": " + (scan.isDegraded() ? "degraded" : "scanned")
                        + (report.statusSet() ? "" : ", status not set"));
            } catch (RuntimeException e) {
                log.error("Commit {}@{} failed, continuing with the remaining commits: {}",
                        repo, shortSha, e.getMessage(), e);
                notes.add(shortSha + ": failed (" + e.getMessage() + ")");
            }
        }

        if (succeeded == 0) {
            lifecycle.advance(EventState.FAILED);
            return new EventOutcome(event.deliveryId(), EventState.FAILED, "no commit could be processed",
                    0, null, notes);
        }
        lifecycle.advance(EventState.CONTENT_GATHERED);
        lifecycle.advance(EventState.SCANNED);
        EventState terminal = degraded ? EventState.DEGRADED_PUBLISHED : EventState.PUBLISHED;
        lifecycle.advance(terminal);

        log.info("Push to {} finished as {}: {}/{} commit(s) processed, {} violation(s)",
                repo, terminal.label(), succeeded, event.commitShas().size(), violations);
        return new EventOutcome(event.deliveryId(), terminal,
                succeeded + "/" + event.commitShas().size() + " commit(s) processed", violations, mergeable, notes);
    }

    /**
     * An empty change set is a clean result; the analysis backend is not called for it.
     */
    private ScanOutcome scanOrSkip(ScanRequest request) {
        if (request.files().isEmpty()) {
            log.info("No changed files for {}, skipping scan", request.target());
            return ScanOutcome.completed(ScanResult.clean(request.repository()));
        }
        return scanClient.scan(request);
    }
}
