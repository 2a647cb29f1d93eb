package dev.guardrails.domain.valueobject;

import dev.guardrails.domain.enums.EventState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal report of one delivery, rendered into the webhook response body.
 */
public record EventOutcome(
        String deliveryId,
        EventState state,
        String detail,
        int violations,
        Boolean mergeable,
        List<String> notes
) {
    public EventOutcome {
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static EventOutcome ignored(String deliveryId, String reason) {
        return new EventOutcome(deliveryId, EventState.IGNORED, reason, 0, null, List.of());
    }

    public static EventOutcome failed(String deliveryId, String reason) {
        return new EventOutcome(deliveryId, EventState.FAILED, reason, 0, null, List.of());
    }

    /**
     * Status word for the response body: processed, degraded, ignored or error.
     */
    public String status() {
        return switch (state) {
            case PUBLISHED -> "processed";
            case DEGRADED_PUBLISHED -> "degraded";
            case IGNORED -> "ignored";
            case REJECTED -> "rejected";
            case FAILED -> "error";
            default -> "accepted";
        };
    }

    public Map<String, Object> toResponseBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status());
        body.put("delivery", deliveryId);
        body.put("state", state.label());
        if (detail != null) body.put(state == EventState.IGNORED ? "reason" : "detail", detail);
        if (mergeable != null) {
            body.put("violations", violations);
            body.put("mergeable", mergeable);
        }
        if (!notes.isEmpty()) body.put("notes", notes);
        return body;
    }
}
