package dev.guardrails.domain.valueobject;

import dev.guardrails.domain.enums.EventKind;
import dev.guardrails.dto.request.WebhookPayload;

import java.util.List;

/**
 * One received webhook delivery. The delivery id keys log correlation; nothing
 * here is mutated after the controller builds it.
 */
public record InboundEvent(
        EventKind kind,
        String action,
        String repository,
        Long installationId,
        String actor,
        String deliveryId,
        WebhookPayload payload
) {
    public InboundEvent {
        if (kind == null) kind = EventKind.OTHER;
        if (deliveryId == null || deliveryId.isBlank())
            throw new IllegalArgumentException("deliveryId required");
    }

    public static InboundEvent from(String eventHeader, String deliveryId, WebhookPayload payload) {
        return new InboundEvent(
                EventKind.fromHeader(eventHeader),
                payload.action(),
                payload.repositoryFullName(),
                payload.installation() != null ? payload.installation().id() : null,
                payload.sender() != null ? payload.sender().login() : null,
                deliveryId,
                payload);
    }

    /**
     * Synthetic pull request event for the operator trigger. The head sha is resolved later.
     */
    public static InboundEvent manualPullRequest(String repository, int prNumber, String deliveryId) {
        WebhookPayload payload = new WebhookPayload("manual",
                new WebhookPayload.PullRequest(prNumber, null, null, null, false),
                new WebhookPayload.Repository(repository, null, null, false),
                null, null, null, null, null, false);
        return new InboundEvent(EventKind.PULL_REQUEST, "manual", repository, null, "operator", deliveryId, payload);
    }

    public Integer pullRequestNumber() {
        return payload != null && payload.pullRequest() != null ? payload.pullRequest().number() : null;
    }

    public String headSha() {
        if (payload == null || payload.pullRequest() == null || payload.pullRequest().head() == null) return null;
        return payload.pullRequest().head().sha();
    }

    public List<String> commitShas() {
        if (payload == null) return List.of();
        return payload.commitsOrEmpty().stream()
                .map(WebhookPayload.Commit::id)
                .filter(id -> id != null && !id.isBlank())
                .toList();
    }
}
