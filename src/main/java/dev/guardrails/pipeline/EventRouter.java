package dev.guardrails.pipeline;

import dev.guardrails.config.PipelineProperties;
import dev.guardrails.domain.enums.EventKind;
import dev.guardrails.domain.enums.EventState;
import dev.guardrails.domain.valueobject.EventOutcome;
import dev.guardrails.domain.valueobject.InboundEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a delivery is actionable and hands it to the {@link EventPipeline}
 * on the event executor.
 *
 * <p>Deliveries are not deduplicated: a redelivery runs again as an independent task,
 * and publication tolerates the repeat.
 */
@Component
public class EventRouter {
    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    static final Set<String> TRACKED_PR_ACTIONS = Set.of("opened", "synchronize", "reopened", "ready_for_review");

    private final EventPipeline pipeline;
    private final TaskExecutor eventExecutor;
    private final PipelineProperties properties;

    public EventRouter(EventPipeline pipeline,
                       @Qualifier("eventExecutor") TaskExecutor eventExecutor,
                       PipelineProperties properties) {
        this.pipeline = pipeline;
        this.eventExecutor = eventExecutor;
        this.properties = properties;
    }

    /**
     * Why the event is not acted on, or {@code null} when it is actionable.
     */
    public String classify(InboundEvent event) {
        if (event.repository() == null) return "payload names no repository";
        if (event.kind() == EventKind.PULL_REQUEST) {
            if (!TRACKED_PR_ACTIONS.contains(event.action())) return "action not tracked: " + event.action();
            if (event.pullRequestNumber() == null) return "payload names no pull request";
            return null;
        }
        if (event.kind() == EventKind.PUSH) {
            if (event.payload() != null && event.payload().deleted()) return "branch deletion";
            if (event.commitShas().isEmpty()) return "push without commits";
            return null;
        }
        return "event not tracked";
    }

    /**
     * Dispatches an actionable event and waits up to the acknowledgement timeout for its
     * outcome. A slower event keeps running and the outcome reported is "accepted".
     */
    public EventOutcome route(InboundEvent event) {
        String reason = classify(event);
        if (reason != null) {
            log.info("Ignoring delivery {} ({} {}): {}", event.deliveryId(), event.kind().header(),
                    event.action(), reason);
            return EventOutcome.ignored(event.deliveryId(), reason);
        }
        log.info("Dispatching delivery {}: {} {} on {}", event.deliveryId(), event.kind().header(),
                event.action(), event.repository());
        return dispatchAndWait(event, properties.ackTimeout());
    }

    /**
     * Runs the pull request pipeline on operator request, waiting for the result.
     */
    public EventOutcome trigger(String owner, String repo, int prNumber) {
        if (prNumber <= 0) throw new IllegalArgumentException("pull request number must be positive");
        InboundEvent event = InboundEvent.manualPullRequest(owner + "/" + repo, prNumber,
                "manual-" + UUID.randomUUID());
        log.info("Manual scan requested for {}#{} as delivery {}", event.repository(), prNumber, event.deliveryId());
        return dispatchAndWait(event, properties.triggerTimeout());
    }

    private EventOutcome dispatchAndWait(InboundEvent event, Duration timeout) {
        CompletableFuture<EventOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(() -> pipeline.process(event), eventExecutor);
        } catch (TaskRejectedException e) {
            log.error("Event executor saturated, dropping delivery {}: {}", event.deliveryId(), e.getMessage());
            return EventOutcome.failed(event.deliveryId(), "event executor saturated");
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("Delivery {} still running after {} ms, acknowledging", event.deliveryId(), timeout.toMillis());
            return new EventOutcome(event.deliveryId(), EventState.RECEIVED, "processing continues in background",
                    0, null, List.of());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Delivery {} failed: {}", event.deliveryId(), cause.getMessage(), cause);
            return EventOutcome.failed(event.deliveryId(), cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EventOutcome.failed(event.deliveryId(), "interrupted while waiting for outcome");
        }
    }
}
