package com.platform.patchwatch.core;

import com.platform.patchwatch.config.PatchWatchProperties;
import com.platform.patchwatch.error.AuthenticationException;
import com.platform.patchwatch.error.ConnectionException;
import com.platform.patchwatch.observability.MetricsRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retries transient connection failures with randomized exponential backoff.
 * Authentication failures and everything else fail on the first attempt.
 */
@Slf4j
@Component
public class RetryEngine {

    private static final double JITTER_FACTOR = 0.1;

    private final MetricsRegistry metricsRegistry;
    private final RetryConfig config;

    @Autowired
    public RetryEngine(PatchWatchProperties properties, MetricsRegistry metricsRegistry) {
        this(properties.retry(), metricsRegistry);
    }

    public RetryEngine(PatchWatchProperties.Retry settings, MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
        this.config = RetryConfig.custom()
            .maxAttempts(Math.max(1, settings.maxAttempts()))
            .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                settings.initialDelay(), settings.multiplier(), JITTER_FACTOR))
            .retryOnException(RetryEngine::isRetryable)
            .failAfterMaxAttempts(false)
            .build();
    }

    static boolean isRetryable(Throwable t) {
        return t instanceof ConnectionException
            && !(t instanceof AuthenticationException)
            && !Thread.currentThread().isInterrupted();
    }

    /**
     * Execute an operation, retrying connection failures.
     *
     * @param operationName short label for logs and metrics
     * @param target        host the operation talks to
     */
    public <T> T executeWithRetry(String operationName, String target, Supplier<T> operation) {
        Retry retry = Retry.of(target + "." + operationName, config);
        retry.getEventPublisher().onRetry(event -> {
            metricsRegistry.recordRetryAttempt(operationName, event.getNumberOfRetryAttempts());
            log.warn("{}.{} failed (attempt {}/{}): {}", target, operationName,
                event.getNumberOfRetryAttempts(), config.getMaxAttempts(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage());
        });
        return Retry.decorateSupplier(retry, operation).get();
    }
}
