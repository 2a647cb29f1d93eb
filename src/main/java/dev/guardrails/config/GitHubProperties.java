package dev.guardrails.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * GitHub App identity and API settings. The private key may be given inline
 * ({@code privateKey}) or as a file ({@code privateKeyPath}); inline wins.
 */
@ConfigurationProperties(prefix = "guardrails.github")
public record GitHubProperties(long appId,
                               String privateKey,
                               String privateKeyPath,
                               String webhookSecret,
                               String apiBaseUrl,
                               String statusContext,
                               int credentialAttempts,
                               Duration tokenRefreshSkew,
                               Duration connectTimeout,
                               Duration responseTimeout) {
    public GitHubProperties {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) apiBaseUrl = "https://api.github.com";
        if (statusContext == null || statusContext.isBlank()) statusContext = "guardrails/security-scan";
        if (credentialAttempts <= 0) credentialAttempts = 2;
        if (tokenRefreshSkew == null) tokenRefreshSkew = Duration.ofMinutes(5);
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(10);
        if (responseTimeout == null) responseTimeout = Duration.ofSeconds(30);
    }

    public boolean hasWebhookSecret() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }
}
