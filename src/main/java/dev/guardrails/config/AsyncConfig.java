package dev.guardrails.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * Event execution configuration.
 *
 * <p>Every webhook delivery becomes one task on a bounded pool. Pipeline work is
 * I/O-bound (GitHub API, analysis backend), so the pool is sized for waiting, not CPU.
 *
 * <p>On shutdown the pool stops accepting deliveries but lets running ones finish,
 * so a pull request is not left without a summary comment or status.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setTaskDecorator(new MdcPropagatingTaskDecorator());
        executor.setCorePoolSize(properties.corePoolSize());
        executor.setMaxPoolSize(properties.maxPoolSize());
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.awaitTermination().toSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Propagates MDC context (deliveryId, repository) from the request thread
     * to the event thread so every log line of a delivery can be correlated.
     */
    public static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
