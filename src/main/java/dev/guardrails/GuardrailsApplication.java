package dev.guardrails;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Guardrails Bridge: GitHub App that routes repository events to the guardrails
 * analysis service and reports the findings back on the pull request.
 *
 * <p>Architecture overview:
 * <pre>
 * GitHub Webhook → WebhookController (HMAC) → EventRouter (classify, dispatch)
 *   → EventPipeline (state machine) → CredentialBroker → ContentFetcher
 *   → ScanClient (analysis backend) → ResultPublisher (comments + commit status)
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Acknowledge-first: the webhook is always answered with 200 unless the signature is bad</li>
 *   <li>Graceful degradation: an unreachable backend yields an advisory result, never a blocked merge</li>
 *   <li>Per-delivery tasks: nothing is shared across events except the credential cache</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GuardrailsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardrailsApplication.class, args);
    }
}
