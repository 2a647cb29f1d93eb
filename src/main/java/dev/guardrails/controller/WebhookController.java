package dev.guardrails.controller;

import dev.guardrails.domain.valueobject.EventOutcome;
import dev.guardrails.domain.valueobject.InboundEvent;
import dev.guardrails.dto.request.WebhookPayload;
import dev.guardrails.infrastructure.github.WebhookSignatureVerifier;
import dev.guardrails.pipeline.EventRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.UUID;

/**
 * GitHub webhook receiver. Verifies the HMAC signature over the raw bytes, then hands
 * the event to the {@link EventRouter} and reports the outcome it had time to reach.
 * Only a signature failure answers with a non-200 status.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);
    private final WebhookSignatureVerifier signatureVerifier;
    private final EventRouter eventRouter;
    private final ObjectMapper objectMapper;

    public WebhookController(WebhookSignatureVerifier signatureVerifier,
                             EventRouter eventRouter,
                             ObjectMapper objectMapper) {
        this.signatureVerifier = signatureVerifier;
        this.eventRouter = eventRouter;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/github")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryHeader,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody byte[] rawBody) {

        String deliveryId = deliveryHeader != null && !deliveryHeader.isBlank()
                ? deliveryHeader : "generated-" + UUID.randomUUID();

        try (MDC.MDCCloseable delivery = MDC.putCloseable("deliveryId", deliveryId);
             MDC.MDCCloseable event = MDC.putCloseable("event", eventType)) {

            // Verify HMAC signature against raw bytes before any deserialization
            if (!signatureVerifier.verify(rawBody, signature).isAccepted()) {
                log.warn("Webhook signature verification failed for delivery={}", deliveryId);
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .body(Map.of("status", "rejected", "delivery", deliveryId, "reason", "invalid signature"));
            }

            if (eventType == null || eventType.isBlank()) {
                log.warn("Webhook delivery={} carries no event header, ignoring", deliveryId);
                return ResponseEntity.ok(EventOutcome.ignored(deliveryId, "missing event header").toResponseBody());
            }

            WebhookPayload payload;
            try {
                payload = objectMapper.readValue(rawBody, WebhookPayload.class);
            } catch (JacksonException e) {
                log.error("Failed to deserialize webhook payload for delivery={}: {}", deliveryId, e.getMessage());
                return invalidPayload(deliveryId);
            }
            // A JSON "null" body binds to no payload at all
            if (payload == null) {
                log.error("Webhook payload for delivery={} is empty", deliveryId);
                return invalidPayload(deliveryId);
            }

            try (MDC.MDCCloseable repository = MDC.putCloseable("repository", payload.repositoryFullName())) {
                log.info("Webhook: event={}, delivery={}, action={}", eventType, deliveryId, payload.action());
                EventOutcome outcome = eventRouter.route(InboundEvent.from(eventType, deliveryId, payload));
                return ResponseEntity.ok(outcome.toResponseBody());
            }
        }
    }

    private static ResponseEntity<Map<String, Object>> invalidPayload(String deliveryId) {
        return ResponseEntity.ok(Map.of("status", "error", "delivery", deliveryId, "reason", "invalid payload"));
    }
}
