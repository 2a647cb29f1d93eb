package dev.guardrails.infrastructure.github;

import dev.guardrails.config.GitHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 verification for GitHub webhooks, computed over the raw request bytes.
 * Uses constant-time comparison to prevent timing attacks.
 *
 * <p>With no secret configured every request is accepted as {@link Verification#UNSIGNED}
 * and a warning is logged; with a secret, a missing or wrong signature is rejected.
 *
 * <p>Rejecting an unsigned request once a secret is configured is stricter than GitHub
 * requires: a deployment that sets a secret expects every delivery to prove it, so a
 * stripped signature header is treated like a forged one.
 */
@Component
public class WebhookSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String PREFIX = "sha256=";

    public enum Verification {
        VERIFIED, UNSIGNED, REJECTED;

        public boolean isAccepted() { return this != REJECTED; }
    }

    private final GitHubProperties properties;

    public WebhookSignatureVerifier(GitHubProperties properties) { this.properties = properties; }

    public Verification verify(byte[] payload, String signature) {
        if (!properties.hasWebhookSecret()) {
            log.warn("Webhook secret not configured, accepting {} request without verification",
                    signature == null ? "unsigned" : "signed");
            return Verification.UNSIGNED;
        }
        if (signature == null || !signature.startsWith(PREFIX)) {
            log.warn("Webhook secret configured but request carries no sha256 signature");
            return Verification.REJECTED;
        }
        String expected = PREFIX + hmacHex(properties.webhookSecret(), payload);
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
        return matches ? Verification.VERIFIED : Verification.REJECTED;
    }

    static String hmacHex(String secret, byte[] payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
