package com.platform.patchwatch.config;

import com.platform.patchwatch.cache.CorruptionPolicy;
import com.platform.patchwatch.model.SudoPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings bound from the {@code patchwatch} prefix.
 */
@ConfigurationProperties(prefix = "patchwatch")
public record PatchWatchProperties(
    @DefaultValue("SKIP") SudoPolicy sudoPolicy,
    @DefaultValue("10s") Duration connectTimeout,
    @DefaultValue("120s") Duration commandTimeout,
    @DefaultValue("5s") Duration pingTimeout,
    @DefaultValue("15") int poolSize,
    @DefaultValue("24h") Duration staleThreshold,
    @DefaultValue("10s") Duration cancelGracePeriod,
    @DefaultValue Cache cache,
    @DefaultValue Retry retry,
    @DefaultValue Ssh ssh,
    List<HostDefinition> hosts
) {

    public PatchWatchProperties {
        hosts = hosts == null ? List.of() : List.copyOf(hosts);
    }

    public record Cache(
        @DefaultValue("patchwatch-cache.json") Path file,
        @DefaultValue("true") boolean autosave,
        @DefaultValue("ABORT") CorruptionPolicy onCorruption
    ) {
    }

    public record Retry(
        @DefaultValue("2") int maxAttempts,
        @DefaultValue("500ms") Duration initialDelay,
        @DefaultValue("2.0") double multiplier
    ) {
    }

    public record Ssh(
        @DefaultValue("ssh") String binary,
        List<String> options
    ) {

        public Ssh {
            options = options == null ? List.of() : List.copyOf(options);
        }
    }

    /**
     * One configured host. Optional fields fall back to the global settings.
     */
    public record HostDefinition(
        String name,
        String address,
        @DefaultValue("22") int port,
        String username,
        String description,
        SudoPolicy sudoPolicy,
        Duration connectTimeout,
        Duration commandTimeout
    ) {
    }
}
