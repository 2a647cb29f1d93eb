package dev.guardrails.pipeline;

import dev.guardrails.domain.enums.EventState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks one delivery through {@link EventState}. Only forward transitions are allowed;
 * a terminal state is final.
 */
final class EventLifecycle {
    private static final Logger log = LoggerFactory.getLogger(EventLifecycle.class);

    private final String deliveryId;
    private EventState state = EventState.RECEIVED;

    EventLifecycle(String deliveryId) {
        this.deliveryId = deliveryId;
    }

    EventState state() {
        return state;
    }

    void advance(EventState next) {
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException("Delivery %s cannot move from %s to %s"
                    .formatted(deliveryId, state.label(), next == null ? "null" : next.label()));
        }
        if (next.isTerminal()) {
            log.info("Delivery {} ended as {} (from {})", deliveryId, next.label(), state.label());
        } else {
            log.debug("Delivery {}: {} → {}", deliveryId, state.label(), next.label());
        }
        state = next;
    }
}
