package dev.guardrails.infrastructure.scanner;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.guardrails.config.ScannerProperties;
import dev.guardrails.domain.valueobject.ChangedFile;
import dev.guardrails.domain.valueobject.ScanOutcome;
import dev.guardrails.domain.valueobject.ScanRequest;
import dev.guardrails.domain.valueobject.ScanResult;
import dev.guardrails.exception.ClientRequestException;
import dev.guardrails.exception.ScanBackendException;
import dev.guardrails.exception.TransientBackendException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client for the external analysis backend.
 *
 * <p>Policy per scan:
 * <pre>
 *  1. Optional health probe (short timeout, failure only logged: the backend may be cold-starting)
 *  2. Up to maxAttempts attempts with exponential backoff between them (Resilience4j Retry)
 *  3. Within an attempt, each candidate endpoint path is tried in order
 *  4. 5xx / connection errors → next path, attempt retryable; 404/405 → next path;
 *     other 4xx → terminal, no retry
 * </pre>
 *
 * <p>The client never throws to its caller. Exhausted retries and rejected requests both
 * become a {@link ScanOutcome.Degraded} outcome: no violations, advisory, mergeable.
 * A down backend must not block merges.
 */
@Component
public class ScanClient {
    private static final Logger log = LoggerFactory.getLogger(ScanClient.class);

    private final WebClient webClient;
    private final ScannerProperties properties;
    private final RetryConfig retryConfig;

    public ScanClient(WebClient.Builder builder, ScannerProperties properties) {
        this.properties = properties;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.requestTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis());
        this.webClient = builder.baseUrl(properties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(properties.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.initialBackoff(), properties.backoffMultiplier(), properties.maxBackoff()))
                .retryOnException(e -> e instanceof ScanBackendException sbe && sbe.isRetryable())
                .build();
    }

    public ScanOutcome scan(ScanRequest request) {
        long started = System.nanoTime();
        if (properties.healthCheckEnabled()) {
            probeHealth();
        }

        ScanRequestBody body = ScanRequestBody.of(request);
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = Retry.of("analysis-backend", retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Scan attempt {}/{} for {} failed, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), properties.maxAttempts(), request.target(),
                event.getWaitInterval().toMillis(), event.getLastThrowable().getMessage()));

        try {
            ScanResult result = Retry.decorateSupplier(retry,
                    () -> submit(body, request, attempts.incrementAndGet())).get();
            log.info("Scan {} for {} completed: {} violations, enforcement={}, canMerge={}",
                    result.scanId(), request.target(), result.violations().size(),
                    result.enforcementAction().wireValue(), result.canMerge());
            if (result.isError()) {
                log.warn("Analysis backend reported an error for {}: {}", request.target(), result.error());
            }
            return ScanOutcome.completed(result);
        } catch (ClientRequestException e) {
            log.error("Analysis backend rejected scan for {} (HTTP {}): {} [files={}, scannable={}]",
                    request.target(), e.statusCode(), e.getMessage(), request.files().size(),
                    request.scannableFileCount());
            return degraded(request, "Analysis request rejected: " + e.getMessage(), attempts.get(), started);
        } catch (TransientBackendException e) {
            log.error("Analysis backend unavailable for {} after {} attempt(s): {}",
                    request.target(), attempts.get(), e.getMessage());
            return degraded(request, "Analysis backend unavailable after " + attempts.get()
                    + " attempt(s): " + e.getMessage(), attempts.get(), started);
        } catch (RuntimeException e) {
            log.error("Unexpected failure scanning {}: {}", request.target(), e.getMessage(), e);
            return degraded(request, "Scan failed: " + e.getMessage(), attempts.get(), started);
        }
    }

    /**
     * Pings the backend's health endpoint. Never fails the scan.
     */
    public boolean probeHealth() {
        try {
            webClient.get().uri(properties.healthPath())
                    .retrieve().toBodilessEntity()
                    .block(properties.healthTimeout());
            log.debug("Analysis backend health probe succeeded");
            return true;
        } catch (RuntimeException e) {
            log.warn("Analysis backend health probe failed (continuing with scan): {}", e.getMessage());
            return false;
        }
    }

    private ScanResult submit(ScanRequestBody body, ScanRequest request, int attempt) {
        TransientBackendException lastTransient = null;
        ClientRequestException lastNotFound = null;

        for (String path : properties.endpointPaths()) {
            try {
                log.debug("Scan attempt {} for {} via {}", attempt, request.target(), path);
                ScanResult result = webClient.post().uri(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(ScanResult.class)
                        .block(properties.requestTimeout());
                if (result == null) {
                    lastTransient = new TransientBackendException("empty response from " + path, 0, null);
                    continue;
                }
                return result;
            } catch (WebClientResponseException e) {
                int status = e.getStatusCode().value();
                if (status == 404 || status == 405) {
                    log.debug("Scan endpoint {} not available (HTTP {}), trying next candidate", path, status);
                    lastNotFound = new ClientRequestException("no scan endpoint at " + path, status, e);
                } else if (e.getStatusCode().is4xxClientError()) {
                    throw new ClientRequestException("HTTP " + status + " from " + path + ": "
                            + abbreviate(e.getResponseBodyAsString()), status, e);
                } else {
                    lastTransient = new TransientBackendException("HTTP " + status + " from " + path, status, e);
                }
            } catch (RuntimeException e) {
                // Connection refused, unresolved host, read timeout, blocking timeout.
                lastTransient = new TransientBackendException(
                        e.getClass().getSimpleName() + " calling " + path + ": " + e.getMessage(), 0, e);
            }
        }
        if (lastTransient != null) throw lastTransient;
        throw lastNotFound != null ? lastNotFound
                : new ClientRequestException("no scan endpoint configured", 0, null);
    }

    private static ScanOutcome degraded(ScanRequest request, String cause, int attempts, long startedNanos) {
        double elapsedMs = (System.nanoTime() - startedNanos) / 1_000_000.0;
        return ScanOutcome.degraded(request.repository(), cause, attempts, elapsedMs);
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() <= 300 ? text : text.substring(0, 300) + "...";
    }

    /**
     * Wire format of the scan request.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ScanRequestBody(
            String repository,
            @JsonProperty("pull_request_number") Integer pullRequestNumber,
            @JsonProperty("commit_sha") String commitSha,
            List<FileEntry> files,
            @JsonProperty("detect_copilot") boolean detectCopilot) {

        static ScanRequestBody of(ScanRequest request) {
            return new ScanRequestBody(request.repository(), request.pullRequestNumber(), request.commitSha(),
                    request.files().stream().map(FileEntry::of).toList(), request.detectAiGenerated());
        }
    }

    record FileEntry(String path, String content, FileMetadata metadata) {
        static FileEntry of(ChangedFile file) {
            return new FileEntry(file.path(), file.scanContent(), new FileMetadata(
                    file.status().wireValue(), file.additions(), file.deletions(), file.changes(), file.language()));
        }
    }

    record FileMetadata(String status, int additions, int deletions, int changes, String language) {}
}
