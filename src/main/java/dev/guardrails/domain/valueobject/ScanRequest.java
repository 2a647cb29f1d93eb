package dev.guardrails.domain.valueobject;

import java.util.List;

/**
 * Normalized analysis request, built once per pull request or commit.
 * Exactly one of prNumber / commitSha identifies the target, the other may be null.
 */
public record ScanRequest(
        String repository,
        Integer pullRequestNumber,
        String commitSha,
        List<ChangedFile> files,
        boolean detectAiGenerated
) {
    public ScanRequest {
        if (repository == null || repository.isBlank()) throw new IllegalArgumentException("repository required");
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static ScanRequest forPullRequest(String repository, int prNumber,
                                             List<ChangedFile> files, boolean detectAiGenerated) {
        return new ScanRequest(repository, prNumber, null, files, detectAiGenerated);
    }

    public static ScanRequest forCommit(String repository, String commitSha,
                                        List<ChangedFile> files, boolean detectAiGenerated) {
        return new ScanRequest(repository, null, commitSha, files, detectAiGenerated);
    }

    public String target() {
        return pullRequestNumber != null
                ? repository + "#" + pullRequestNumber
                : repository + "@" + (commitSha != null && commitSha.length() > 7 ? commitSha.substring(0, 7) : commitSha);
    }

    public long scannableFileCount() {
        return files.stream().filter(f -> !f.isRemoved()).count();
    }
}
