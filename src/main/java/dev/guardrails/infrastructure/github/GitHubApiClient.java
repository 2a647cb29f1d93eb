package dev.guardrails.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.guardrails.config.GitHubProperties;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * GitHub REST API client for the installation-scoped calls: reading pull request and
 * commit files, and writing comments and commit statuses.
 *
 * <p>Calls block with timeouts. A 401 drops the cached installation token and the call
 * is retried once with a fresh one; any other error propagates to the caller.
 */
@Component
public class GitHubApiClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);
    private static final int FILES_PER_PAGE = 100;
    private static final int MAX_PAGES = 10;

    private final WebClient webClient;
    private final CredentialBroker credentialBroker;

    public GitHubApiClient(WebClient.Builder builder, CredentialBroker credentialBroker, GitHubProperties properties) {
        this.credentialBroker = credentialBroker;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.responseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis());
        this.webClient = builder.baseUrl(properties.apiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }

    public List<GitHubFile> getPullRequestFiles(String repo, int pr, long installationId) {
        List<GitHubFile> allFiles = new ArrayList<>();

        for (int page = 1; page <= MAX_PAGES; page++) {
            String uri = "/repos/" + repo + "/pulls/" + pr + "/files?per_page=" + FILES_PER_PAGE + "&page=" + page;
            List<GitHubFile> files = withToken(installationId, token -> webClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<List<GitHubFile>>() {})
                    .block());

            if (files == null || files.isEmpty()) break;
            allFiles.addAll(files);
            if (files.size() < FILES_PER_PAGE) break;
        }

        if (allFiles.size() >= FILES_PER_PAGE * MAX_PAGES) {
            log.warn("PR {}#{} has {}+ files, scan may be incomplete", repo, pr, allFiles.size());
        }
        return allFiles;
    }

    public List<GitHubFile> getCommitFiles(String repo, String sha, long installationId) {
        CommitResponse commit = withToken(installationId, token -> webClient.get()
                .uri("/repos/" + repo + "/commits/" + sha)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .bodyToMono(CommitResponse.class)
                .block());
        List<GitHubFile> files = commit != null && commit.files() != null ? commit.files() : List.of();
        log.debug("Commit {}@{} has {} files", repo, sha, files.size());
        return files;
    }

    /**
     * Raw file content at {@code ref}. A missing file surfaces as {@link WebClientResponseException}.
     */
    public String getFileContent(String repo, String path, String ref, long installationId) {
        return withToken(installationId, token -> webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/repos/" + repo + "/contents/" + path)
                        .queryParam("ref", ref).build())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .header(HttpHeaders.ACCEPT, "application/vnd.github.raw+json")
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .block());
    }

    public String getPullRequestHeadSha(String repo, int pr, long installationId) {
        PullRequestResponse response = withToken(installationId, token -> webClient.get()
                .uri("/repos/" + repo + "/pulls/" + pr)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .bodyToMono(PullRequestResponse.class)
                .block());
        if (response == null || response.head() == null || response.head().sha() == null) {
            throw new IllegalStateException("Pull request " + repo + "#" + pr + " has no head sha");
        }
        return response.head().sha();
    }

    public void createIssueComment(String repo, int number, String body, long installationId) {
        withToken(installationId, token -> webClient.post()
                .uri("/repos/" + repo + "/issues/" + number + "/comments")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .bodyValue(Map.of("body", body))
                .retrieve().toBodilessEntity().block());
        log.info("Summary comment posted on {}#{}", repo, number);
    }

    public void createReviewComment(String repo, int pr, String commitId, String path, int line,
                                    String body, long installationId) {
        withToken(installationId, token -> webClient.post()
                .uri("/repos/" + repo + "/pulls/" + pr + "/comments")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .bodyValue(Map.of("body", body, "commit_id", commitId, "path", path,
                        "line", line, "side", "RIGHT"))
                .retrieve().toBodilessEntity().block());
        log.debug("Review comment posted on {}#{} at {}:{}", repo, pr, path, line);
    }

    public void createCommitStatus(String repo, String sha, String state, String description,
                                   String context, long installationId) {
        withToken(installationId, token -> webClient.post()
                .uri("/repos/" + repo + "/statuses/" + sha)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .bodyValue(Map.of("state", state, "description", description, "context", context))
                .retrieve().toBodilessEntity().block());
        log.info("Commit status {} set on {}@{}", state, repo, sha);
    }

    private <T> T withToken(long installationId, Function<String, T> call) {
        try {
            return call.apply(credentialBroker.tokenFor(installationId).value());
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() != HttpStatus.UNAUTHORIZED.value()) throw e;
            log.warn("GitHub rejected installation token for installation {}, refreshing", installationId);
            credentialBroker.invalidate(installationId);
            return call.apply(credentialBroker.tokenFor(installationId).value());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CommitResponse(String sha, List<GitHubFile> files) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PullRequestResponse(Integer number, Head head) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Head(String sha) {}
}
