package dev.guardrails.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The subset of GitHub's pull_request and push payloads the pipeline reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookPayload(
        String action,
        @JsonProperty("pull_request") PullRequest pullRequest,
        Repository repository,
        Installation installation,
        Sender sender,
        List<Commit> commits,
        String ref,
        String after,
        Boolean deleted
) {
    public WebhookPayload {
        if (deleted == null) deleted = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(Integer number, Head head, Base base, String title, Boolean draft) {
        public PullRequest {
            if (draft == null) draft = false;
        }
    }
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(String sha, String ref) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Base(String ref) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("full_name") String fullName, String name, Owner owner,
                             @JsonProperty("private") Boolean isPrivate) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Owner(String login) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Installation(Long id) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Sender(String login) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Commit(String id, String message, Boolean distinct) {}

    public List<Commit> commitsOrEmpty() {
        return commits != null ? commits : List.of();
    }

    public String repositoryFullName() {
        return repository != null ? repository.fullName() : null;
    }
}
