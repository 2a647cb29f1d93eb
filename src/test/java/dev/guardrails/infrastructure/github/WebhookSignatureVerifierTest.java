package dev.guardrails.infrastructure.github;

import dev.guardrails.config.GitHubProperties;
import dev.guardrails.infrastructure.github.WebhookSignatureVerifier.Verification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final byte[] BODY = "{\"action\":\"opened\"}".getBytes(StandardCharsets.UTF_8);

    private static WebhookSignatureVerifier verifier(String secret) {
        return new WebhookSignatureVerifier(
                new GitHubProperties(1L, null, null, secret, null, null, 0, null, null, null));
    }

    @Test
    @DisplayName("accepts the signature GitHub computes for the raw body")
    void acceptsMatchingSignature() {
        String signature = "sha256=" + WebhookSignatureVerifier.hmacHex("s3cret", BODY);
        assertThat(verifier("s3cret").verify(BODY, signature)).isEqualTo(Verification.VERIFIED);
    }

    @Test
    @DisplayName("known HMAC-SHA256 vector from GitHub's documentation")
    void matchesDocumentedVector() {
        byte[] payload = "Hello, World!".getBytes(StandardCharsets.UTF_8);
        assertThat(WebhookSignatureVerifier.hmacHex("It's a Secret to Everybody", payload))
                .isEqualTo("757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17");
    }

    @Test
    @DisplayName("rejects a signature computed with another secret")
    void rejectsMismatch() {
        String signature = "sha256=" + WebhookSignatureVerifier.hmacHex("other", BODY);
        assertThat(verifier("s3cret").verify(BODY, signature)).isEqualTo(Verification.REJECTED);
    }

    @Test
    @DisplayName("rejects a tampered body")
    void rejectsTamperedBody() {
        String signature = "sha256=" + WebhookSignatureVerifier.hmacHex("s3cret", BODY);
        byte[] tampered = "{\"action\":\"closed\"}".getBytes(StandardCharsets.UTF_8);
        assertThat(verifier("s3cret").verify(tampered, signature).isAccepted()).isFalse();
    }

    @Test
    @DisplayName("rejects a missing signature when a secret is configured")
    void rejectsMissingSignature() {
        assertThat(verifier("s3cret").verify(BODY, null)).isEqualTo(Verification.REJECTED);
        assertThat(verifier("s3cret").verify(BODY, "sha1=abc")).isEqualTo(Verification.REJECTED);
    }

    @Test
    @DisplayName("accepts unsigned requests when no secret is configured")
    void acceptsWithoutSecret() {
        assertThat(verifier(null).verify(BODY, null)).isEqualTo(Verification.UNSIGNED);
        assertThat(verifier("").verify(BODY, "sha256=whatever").isAccepted()).isTrue();
    }
}
