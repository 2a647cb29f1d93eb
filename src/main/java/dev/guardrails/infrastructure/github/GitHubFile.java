package dev.guardrails.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A file entry from the pull request files or commit API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubFile(String filename, String status, String patch,
                         Integer additions, Integer deletions, Integer changes) {
    public GitHubFile {
        if (additions == null) additions = 0;
        if (deletions == null) deletions = 0;
        if (changes == null) changes = 0;
    }
}
