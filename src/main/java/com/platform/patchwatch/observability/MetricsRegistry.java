package com.platform.patchwatch.observability;

import com.platform.patchwatch.model.HostResult;
import com.platform.patchwatch.model.Operation;
import com.platform.patchwatch.state.HostState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Central registry for application metrics: host operations, transitions,
 * remote sessions, retries and cache activity.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }

    /**
     * Register a gauge backed by a live value supplier.
     */
    public void registerGauge(String name, String description, Supplier<Number> valueSupplier) {
        Gauge.builder(name, valueSupplier)
            .description(description)
            .register(meterRegistry);
    }

    /**
     * Record the outcome of one host operation.
     */
    public void recordHostResult(HostResult result, long latencyMs) {
        String operation = result.operation().name().toLowerCase();
        getCounter("patchwatch.host.operation", "operation", operation,
            "status", result.status().name().toLowerCase()).increment();

        String timerKey = "host." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("patchwatch.host.operation.latency")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(latencyMs));
    }

    /**
     * Record the wall time of a whole fleet operation.
     */
    public void recordFleetOperation(Operation operation, Duration elapsed) {
        String op = operation.name().toLowerCase();
        timers.computeIfAbsent("fleet." + op, k ->
            Timer.builder("patchwatch.fleet.operation.latency")
                .tag("operation", op)
                .register(meterRegistry))
            .record(elapsed);
    }

    public void recordStateTransition(HostState from, HostState to) {
        getCounter("patchwatch.state.transition",
            "from", from.name(), "to", to.name()).increment();
    }

    public void incrementInvalidTransitions(String host) {
        getCounter("patchwatch.state.invalid_transition").increment();
        log.debug("Invalid transition recorded for {}", host);
    }

    public void recordRetryAttempt(String operation, int attemptNumber) {
        getCounter("patchwatch.retry.attempt", "operation", operation).increment();
        log.debug("Retry attempt {} recorded for {}", attemptNumber, operation);
    }

    public void recordSupersededCommit(String host) {
        getCounter("patchwatch.commit.superseded").increment();
        log.debug("Discarded superseded commit for {}", host);
    }

    public void recordCacheWrite(boolean success) {
        getCounter("patchwatch.cache.write", "outcome", success ? "success" : "failure").increment();
    }

    public void recordCacheMigration(int fromVersion, int toVersion) {
        getCounter("patchwatch.cache.migration",
            "from", String.valueOf(fromVersion), "to", String.valueOf(toVersion)).increment();
    }

    public void recordError(String code) {
        getCounter("patchwatch.api.error", "code", code).increment();
    }

    private Counter getCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        return counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry));
    }
}
