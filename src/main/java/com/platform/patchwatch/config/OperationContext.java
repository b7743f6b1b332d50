package com.platform.patchwatch.config;

import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.SudoPolicy;

import java.time.Duration;

/**
 * Run-wide settings handed to the scheduler and its per-host tasks.
 */
public record OperationContext(
    SudoPolicy globalSudoPolicy,
    Duration connectTimeout,
    Duration commandTimeout,
    Duration pingTimeout,
    int poolSize,
    Duration staleThreshold,
    Duration cancelGracePeriod
) {

    public static OperationContext from(PatchWatchProperties properties) {
        return new OperationContext(
            properties.sudoPolicy(),
            properties.connectTimeout(),
            properties.commandTimeout(),
            properties.pingTimeout(),
            properties.poolSize(),
            properties.staleThreshold(),
            properties.cancelGracePeriod());
    }

    public static OperationContext defaults() {
        return new OperationContext(SudoPolicy.SKIP, Duration.ofSeconds(10), Duration.ofSeconds(120),
            Duration.ofSeconds(5), 15, Duration.ofHours(24), Duration.ofSeconds(10));
    }

    public Duration connectTimeoutFor(HostView host) {
        return host.connectTimeout() != null ? host.connectTimeout() : connectTimeout;
    }

    public Duration commandTimeoutFor(HostView host) {
        return host.commandTimeout() != null ? host.commandTimeout() : commandTimeout;
    }

    public OperationContext withPoolSize(int poolSize) {
        return new OperationContext(globalSudoPolicy, connectTimeout, commandTimeout, pingTimeout,
            poolSize, staleThreshold, cancelGracePeriod);
    }

    public OperationContext withCancelGracePeriod(Duration cancelGracePeriod) {
        return new OperationContext(globalSudoPolicy, connectTimeout, commandTimeout, pingTimeout,
            poolSize, staleThreshold, cancelGracePeriod);
    }
}
