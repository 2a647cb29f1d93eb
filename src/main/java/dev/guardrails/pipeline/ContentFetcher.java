package dev.guardrails.pipeline;

import dev.guardrails.domain.enums.FileStatus;
import dev.guardrails.domain.valueobject.ChangedFile;
import dev.guardrails.infrastructure.github.GitHubApiClient;
import dev.guardrails.infrastructure.github.GitHubFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the files a pull request or commit changed and retrieves their content.
 *
 * <p>Per-file failures never abort the batch: a file whose content cannot be fetched
 * falls back to its patch, and is dropped only when there is no patch either.
 * Removed files are kept (metadata only) so the scan request still lists them.
 */
@Component
public class ContentFetcher {
    private static final Logger log = LoggerFactory.getLogger(ContentFetcher.class);

    private final GitHubApiClient gitHubClient;

    public ContentFetcher(GitHubApiClient gitHubClient) {
        this.gitHubClient = gitHubClient;
    }

    public List<ChangedFile> pullRequestFiles(String repo, int pr, String headSha, long installationId) {
        List<GitHubFile> listed = gitHubClient.getPullRequestFiles(repo, pr, installationId);
        log.info("PR {}#{} changes {} files", repo, pr, listed.size());
        return resolveContent(repo, headSha, listed, installationId);
    }

    public List<ChangedFile> commitFiles(String repo, String sha, long installationId) {
        List<GitHubFile> listed = gitHubClient.getCommitFiles(repo, sha, installationId);
        log.info("Commit {}@{} changes {} files", repo, shortSha(sha), listed.size());
        return resolveContent(repo, sha, listed, installationId);
    }

    private List<ChangedFile> resolveContent(String repo, String ref, List<GitHubFile> listed, long installationId) {
        List<ChangedFile> files = new ArrayList<>(listed.size());
        int patchFallbacks = 0;
        int omitted = 0;

        for (GitHubFile entry : listed) {
            if (entry.filename() == null || entry.filename().isBlank()) continue;
            ChangedFile file = new ChangedFile(entry.filename(), FileStatus.fromApi(entry.status()), null,
                    entry.patch(), entry.additions(), entry.deletions(), entry.changes(), null);

            if (file.isRemoved() || ref == null) {
                files.add(file);
                continue;
            }
            try {
                files.add(file.withContent(gitHubClient.getFileContent(repo, file.path(), ref, installationId)));
            } catch (RuntimeException e) {
                if (file.patch() != null) {
                    log.warn("Content of {} at {} unavailable, scanning its patch instead: {}",
                            file.path(), shortSha(ref), e.getMessage());
                    files.add(file);
                    patchFallbacks++;
                } else {
                    log.warn("Content of {} at {} unavailable and no patch, omitting file: {}",
                            file.path(), shortSha(ref), e.getMessage());
                    omitted++;
                }
            }
        }

        if (patchFallbacks > 0 || omitted > 0) {
            log.info("Fetched {} files for {}@{} ({} via patch, {} omitted)",
                    files.size(), repo, shortSha(ref), patchFallbacks, omitted);
        }
        return files;
    }

    static String shortSha(String sha) {
        return sha != null && sha.length() > 7 ? sha.substring(0, 7) : String.valueOf(sha);
    }
}
