package dev.guardrails.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Event executor sizing and acknowledgement timing.
 * ackTimeout is how long the webhook response waits for the outcome before answering "accepted".
 */
@ConfigurationProperties(prefix = "guardrails.pipeline")
public record PipelineProperties(Duration ackTimeout,
                                 Duration triggerTimeout,
                                 int corePoolSize,
                                 int maxPoolSize,
                                 int queueCapacity,
                                 Duration awaitTermination) {
    public PipelineProperties {
        if (ackTimeout == null) ackTimeout = Duration.ofSeconds(8);
        if (triggerTimeout == null) triggerTimeout = Duration.ofMinutes(20);
        if (corePoolSize <= 0) corePoolSize = 4;
        if (maxPoolSize < corePoolSize) maxPoolSize = Math.max(16, corePoolSize);
        if (queueCapacity <= 0) queueCapacity = 100;
        if (awaitTermination == null) awaitTermination = Duration.ofMinutes(6);
    }
}
