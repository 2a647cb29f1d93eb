package dev.guardrails.infrastructure.github;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import dev.guardrails.config.GitHubProperties;
import dev.guardrails.domain.valueobject.AccessToken;
import dev.guardrails.domain.valueobject.Installation;
import dev.guardrails.exception.ConfigurationException;
import dev.guardrails.exception.CredentialExchangeException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.interfaces.RSAPrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Manages GitHub App authentication: generates JWTs signed with the App's private key,
 * resolves the installation bound to a repository, exchanges it for a short-lived
 * installation token, and caches those tokens.
 *
 * <p>Caches are concurrent maps keyed by repository and installation id, so a refresh
 * for one installation never blocks another. Concurrent refreshes of the same
 * installation share a single in-flight exchange.
 */
@Component
public class CredentialBroker {
    private static final Logger log = LoggerFactory.getLogger(CredentialBroker.class);
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final GitHubProperties properties;
    private final WebClient webClient;
    private final Clock clock;
    private final RSAPrivateKey privateKey;
    private final RetryConfig exchangeRetry;
    private final Map<Long, AccessToken> tokens = new ConcurrentHashMap<>();
    private final Map<Long, CompletableFuture<AccessToken>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, Installation> installations = new ConcurrentHashMap<>();

    public CredentialBroker(GitHubProperties properties, WebClient.Builder builder, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.responseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis());
        this.webClient = builder.baseUrl(properties.apiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .build();
        this.privateKey = loadPrivateKey(properties);
        this.exchangeRetry = RetryConfig.custom()
                .maxAttempts(properties.credentialAttempts())
                .waitDuration(Duration.ofMillis(500))
                .retryExceptions(WebClientException.class)
                .build();
    }

    /**
     * Finds the installation bound to {@code owner/repo}, using the app's own JWT.
     */
    public Installation resolveInstallation(String repository) {
        Installation cached = installations.get(repository);
        if (cached != null) return cached;

        Map<String, Object> response = callIdentityProvider("installation lookup for " + repository,
                () -> webClient.get()
                        .uri("/repos/" + repository + "/installation")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + appJwt())
                        .retrieve()
                        .bodyToMono(JSON_OBJECT)
                        .block());

        if (response == null || !(response.get("id") instanceof Number id)) {
            throw new CredentialExchangeException("No installation found for " + repository, null);
        }
        Installation installation = new Installation(id.longValue(), repository);
        installations.put(repository, installation);
        log.info("Resolved installation {} for {}", installation.id(), repository);
        return installation;
    }

    public AccessToken tokenFor(Installation installation) {
        return tokenFor(installation.id());
    }

    /**
     * Returns a cached token that is not about to expire, or exchanges a new one.
     * Only one exchange per installation runs at a time; other callers wait for it.
     */
    public AccessToken tokenFor(long installationId) {
        AccessToken cached = usableToken(installationId);
        if (cached != null) {
            log.debug("Using cached installation token for installation {}", installationId);
            return cached;
        }

        CompletableFuture<AccessToken> mine = new CompletableFuture<>();
        CompletableFuture<AccessToken> running = inFlight.putIfAbsent(installationId, mine);
        if (running != null) {
            log.debug("Joining in-flight token exchange for installation {}", installationId);
            return await(running, installationId);
        }

        try {
            // Another caller may have finished an exchange between the cache check and putIfAbsent.
            AccessToken fresh = usableToken(installationId);
            if (fresh == null) {
                fresh = exchange(installationId);
                tokens.put(installationId, fresh);
            }
            mine.complete(fresh);
            return fresh;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(installationId, mine);
        }
    }

    /**
     * Drops the cached token, e.g. after GitHub answered 401 with it.
     */
    public void invalidate(long installationId) {
        if (tokens.remove(installationId) != null) {
            log.info("Invalidated installation token for installation {}", installationId);
        }
    }

    private AccessToken usableToken(long installationId) {
        AccessToken token = tokens.get(installationId);
        return token != null && token.isUsableAt(clock.instant(), properties.tokenRefreshSkew()) ? token : null;
    }

    private AccessToken exchange(long installationId) {
        Map<String, Object> response = callIdentityProvider("token exchange for installation " + installationId,
                () -> webClient.post()
                        .uri("/app/installations/{installationId}/access_tokens", installationId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + appJwt())
                        .retrieve()
                        .bodyToMono(JSON_OBJECT)
                        .block());

        if (response == null || !(response.get("token") instanceof String value)) {
            throw new CredentialExchangeException(
                    "Failed to obtain installation token for installation " + installationId, null);
        }
        Instant expiresAt;
        try {
            expiresAt = Instant.parse(String.valueOf(response.get("expires_at")));
        } catch (DateTimeParseException e) {
            // GitHub documents one hour; assume it when the field is unreadable.
            expiresAt = clock.instant().plus(Duration.ofHours(1));
        }
        AccessToken token = new AccessToken(value, expiresAt);
        log.info("Obtained installation token for installation {} (expires {})", installationId, expiresAt);
        return token;
    }

    private <T> T callIdentityProvider(String what, Supplier<T> call) {
        Retry retry = Retry.of("github-identity", exchangeRetry);
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (WebClientException e) {
            log.error("GitHub {} failed after {} attempt(s): {}", what, properties.credentialAttempts(), e.getMessage());
            throw new CredentialExchangeException("GitHub " + what + " failed: " + e.getMessage(), e);
        }
    }

    private AccessToken await(CompletableFuture<AccessToken> running, long installationId) {
        long waitMillis = properties.responseTimeout().toMillis() * properties.credentialAttempts()
                + properties.connectTimeout().toMillis();
        try {
            return running.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new CredentialExchangeException("Token exchange failed for installation " + installationId, e.getCause());
        } catch (TimeoutException e) {
            throw new CredentialExchangeException("Timed out waiting for token exchange of installation " + installationId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CredentialExchangeException("Interrupted waiting for token exchange of installation " + installationId, e);
        }
    }

    String appJwt() {
        if (privateKey == null) {
            throw new ConfigurationException(
                    "GitHub App private key not configured (guardrails.github.private-key or private-key-path)");
        }
        if (properties.appId() <= 0) {
            throw new ConfigurationException("GitHub App id not configured (guardrails.github.app-id)");
        }
        try {
            Instant now = clock.instant();
            JWTClaimsSet claims = new JWTClaimsSet.Builder()
                    .issuer(String.valueOf(properties.appId()))
                    .issueTime(Date.from(now.minusSeconds(60)))  // clock skew buffer
                    .expirationTime(Date.from(now.plusSeconds(600)))  // 10 min max
                    .build();

            SignedJWT signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
            signedJwt.sign(new RSASSASigner(privateKey));
            return signedJwt.serialize();
        } catch (JOSEException e) {
            throw new ConfigurationException("Failed to sign JWT for GitHub App " + properties.appId(), e);
        }
    }

    private static RSAPrivateKey loadPrivateKey(GitHubProperties properties) {
        if (properties.privateKey() != null && !properties.privateKey().isBlank()) {
            return PrivateKeyDecoder.decode(properties.privateKey());
        }
        if (properties.privateKeyPath() != null && !properties.privateKeyPath().isBlank()) {
            try {
                return PrivateKeyDecoder.decode(Files.readString(Path.of(properties.privateKeyPath())));
            } catch (IOException e) {
                throw new ConfigurationException(
                        "Cannot read GitHub App private key file " + properties.privateKeyPath(), e);
            }
        }
        log.warn("GitHub App private key not configured, token exchange will fail at first use");
        return null;
    }
}
