package dev.guardrails.infrastructure.scanner;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.guardrails.config.ScannerProperties;
import dev.guardrails.domain.enums.EnforcementMode;
import dev.guardrails.domain.enums.FileStatus;
import dev.guardrails.domain.enums.Severity;
import dev.guardrails.domain.valueobject.ChangedFile;
import dev.guardrails.domain.valueobject.ScanOutcome;
import dev.guardrails.domain.valueobject.ScanRequest;
import dev.guardrails.domain.valueobject.ScanResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@WireMockTest
class ScanClientTest {

    private static final ScanRequest REQUEST = ScanRequest.forPullRequest("acme/widgets", 7, List.of(
            new ChangedFile("src/App.java", FileStatus.MODIFIED, "class App {}", null, 3, 1, 4, null),
            new ChangedFile("old/Gone.java", FileStatus.REMOVED, null, null, 0, 9, 9, null)), true);

    private static final String RESULT_JSON = """
            {
              "scan_id": "scan-123",
              "repository": "acme/widgets",
              "violations": [{
                "rule_id": "SEC-001",
                "rule_name": "Hardcoded secret",
                "category": "security",
                "severity": "critical",
                "file_path": "src/App.java",
                "line_number": 3,
                "message": "Secret in source",
                "explanation": "Credentials must come from the environment.",
                "fix_suggestion": "String key = System.getenv(\\"KEY\\");",
                "standard_mappings": ["CWE-798"],
                "is_copilot_generated": true,
                "ai_confidence": 0.92
              }],
              "summary": {
                "total_violations": 1,
                "by_severity": {"critical": 1, "high": 0, "medium": 0, "low": 0},
                "by_category": {"security": 1},
                "copilot_violations": 1,
                "files_affected": 1
              },
              "enforcement_action": "blocking",
              "can_merge": false,
              "copilot_detected": true,
              "processing_time_ms": 152.5,
              "scanned_at": "2026-03-01T10:00:00Z"
            }
            """;

    private static ScanClient client(WireMockRuntimeInfo wmInfo, List<String> paths, int maxAttempts) {
        ScannerProperties properties = new ScannerProperties(wmInfo.getHttpBaseUrl(), paths, "/health", true,
                Duration.ofSeconds(1), maxAttempts, Duration.ofMillis(10), 2.0, Duration.ofMillis(50),
                Duration.ofSeconds(5), Duration.ofSeconds(2), true);
        return new ScanClient(WebClient.builder(), properties);
    }

    @Test
    @DisplayName("parses the backend result")
    void parsesResult(WireMockRuntimeInfo wmInfo) {
        stubFor(get("/health").willReturn(okJson("{\"status\":\"healthy\"}")));
        stubFor(post("/scan").willReturn(okJson(RESULT_JSON)));

        ScanOutcome outcome = client(wmInfo, List.of("/scan"), 3).scan(REQUEST);

        assertThat(outcome.isDegraded()).isFalse();
        ScanResult result = outcome.result();
        assertThat(result.scanId()).isEqualTo("scan-123");
        assertThat(result.canMerge()).isFalse();
        assertThat(result.enforcementAction()).isEqualTo(EnforcementMode.BLOCKING);
        assertThat(result.aiCodeDetected()).isTrue();
        assertThat(result.summary().bySeverity().critical()).isEqualTo(1);
        assertThat(result.violations()).singleElement().satisfies(v -> {
            assertThat(v.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(v.lineNumber()).isEqualTo(3);
            assertThat(v.standardMappings()).containsExactly("CWE-798");
            assertThat(v.aiGenerated()).isTrue();
        });
    }

    @Test
    @DisplayName("sends the snake_case request with file metadata and no commit sha for pull requests")
    void requestWireFormat(WireMockRuntimeInfo wmInfo) {
        stubFor(post("/scan").willReturn(okJson(RESULT_JSON)));

        client(wmInfo, List.of("/scan"), 1).scan(REQUEST);

        verify(postRequestedFor(urlEqualTo("/scan"))
                .withRequestBody(matchingJsonPath("$.repository", equalTo("acme/widgets")))
                .withRequestBody(matchingJsonPath("$.pull_request_number", equalTo("7")))
                .withRequestBody(matchingJsonPath("$.detect_copilot", equalTo("true")))
                .withRequestBody(matchingJsonPath("$.files[0].content", equalTo("class App {}")))
                .withRequestBody(matchingJsonPath("$.files[0].metadata.language", equalTo("java")))
                .withRequestBody(matchingJsonPath("$.files[1].metadata.status", equalTo("removed")))
                .withRequestBody(matchingJsonPath("$.files[1].content", equalTo("")))
                .withRequestBody(notContaining("commit_sha")));
    }


    @Test
    @DisplayName("persistent 503 degrades after exactly max-attempts attempts")
    void persistentUnavailable(WireMockRuntimeInfo wmInfo) {
        stubFor(post("/scan").willReturn(serviceUnavailable()));

        ScanOutcome outcome = client(wmInfo, List.of("/scan"), 3).scan(REQUEST);

        assertThat(outcome).isInstanceOf(ScanOutcome.Degraded.class);
        ScanOutcome.Degraded degraded = (ScanOutcome.Degraded) outcome;
        assertThat(degraded.attempts()).isEqualTo(3);
        assertThat(degraded.result().isError()).isTrue();
        assertThat(degraded.result().canMerge()).isTrue();
        assertThat(degraded.result().enforcementAction()).isEqualTo(EnforcementMode.ADVISORY);
        assertThat(degraded.result().violations()).isEmpty();
        assertThat(degraded.cause()).contains("after 3 attempt(s)");
        verify(3, postRequestedFor(urlEqualTo("/scan")));
    }

    @Test
    @DisplayName("400 is terminal: one attempt, degraded")
    void badRequestIsTerminal(WireMockRuntimeInfo wmInfo) {
        stubFor(post("/scan").willReturn(badRequest().withBody("{\"detail\":\"files required\"}")));
        stubFor(post("/api/v1/scan").willReturn(okJson(RESULT_JSON)));

        ScanOutcome outcome = client(wmInfo, List.of("/scan", "/api/v1/scan"), 3).scan(REQUEST);

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(((ScanOutcome.Degraded) outcome).attempts()).isEqualTo(1);
        assertThat(((ScanOutcome.Degraded) outcome).cause()).startsWith("Analysis request rejected");
        verify(1, postRequestedFor(urlEqualTo("/scan")));
        verify(0, postRequestedFor(urlEqualTo("/api/v1/scan")));
    }

    @Test
    @DisplayName("404 on one path falls through to the next candidate")
    void fallsBackOnNotFound(WireMockRuntimeInfo wmInfo) {
        stubFor(post("/scan").willReturn(notFound()));
        stubFor(post("/api/v1/scan/").willReturn(okJson(RESULT_JSON)));

        ScanOutcome outcome = client(wmInfo, List.of("/scan", "/api/v1/scan/", "/api/v1/scan"), 3).scan(REQUEST);

        assertThat(outcome.isDegraded()).isFalse();
        assertThat(outcome.result().scanId()).isEqualTo("scan-123");
        verify(0, postRequestedFor(urlEqualTo("/api/v1/scan")));
    }

    @Test
    @DisplayName("every candidate answering 404 is terminal")
    void allPathsMissing(WireMockRuntimeInfo wmInfo) {
        stubFor(post(urlMatching("/.*")).willReturn(notFound()));

        ScanOutcome outcome = client(wmInfo, List.of("/scan", "/api/v1/scan"), 3).scan(REQUEST);

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(((ScanOutcome.Degraded) outcome).attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("a failing health probe does not block the scan")
    void healthProbeFailureIsNonBlocking(WireMockRuntimeInfo wmInfo) {
        stubFor(get("/health").willReturn(serverError()));
        stubFor(post("/scan").willReturn(okJson(RESULT_JSON)));

        ScanClient client = client(wmInfo, List.of("/scan"), 1);

        assertThat(client.probeHealth()).isFalse();
        assertThat(client.scan(REQUEST).isDegraded()).isFalse();
    }

    @Test
    @DisplayName("connection refused degrades instead of throwing")
    void connectionRefused() {
        ScannerProperties properties = new ScannerProperties("http://localhost:1", List.of("/scan"), "/health",
                false, null, 2, Duration.ofMillis(10), 2.0, Duration.ofMillis(20),
                Duration.ofSeconds(2), Duration.ofSeconds(1), true);

        ScanOutcome outcome = new ScanClient(WebClient.builder(), properties).scan(REQUEST);

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(((ScanOutcome.Degraded) outcome).attempts()).isEqualTo(2);
        assertThat(outcome.result().canMerge()).isTrue();
    }
}
