package dev.guardrails.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

/**
 * Shared infrastructure beans for the outbound clients.
 */
@Configuration
public class InfrastructureConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Prototype: every client customizes its own builder (base URL, connector, headers).
    @Bean
    @Scope("prototype")
    @ConditionalOnMissingBean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder();
    }
}
