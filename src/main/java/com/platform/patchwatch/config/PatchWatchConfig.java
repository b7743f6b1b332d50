package com.platform.patchwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.patchwatch.cache.CacheStore;
import com.platform.patchwatch.cache.SnapshotCodec;
import com.platform.patchwatch.cache.SnapshotMigrator;
import com.platform.patchwatch.inventory.Inventory;
import com.platform.patchwatch.observability.MetricsRegistry;
import com.platform.patchwatch.state.HostStateMachine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the pieces built from configuration rather than discovered by scanning.
 */
@Configuration
@EnableConfigurationProperties(PatchWatchProperties.class)
public class PatchWatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OperationContext operationContext(PatchWatchProperties properties) {
        return OperationContext.from(properties);
    }

    @Bean
    public Inventory inventory(PatchWatchProperties properties, HostStateMachine stateMachine,
                               MetricsRegistry metricsRegistry) {
        return new Inventory(properties.hosts(), stateMachine, metricsRegistry);
    }

    @Bean
    public CacheStore cacheStore(PatchWatchProperties properties, ObjectMapper objectMapper,
                                 SnapshotCodec codec, SnapshotMigrator migrator, MetricsRegistry metricsRegistry) {
        return new CacheStore(properties.cache().file(), objectMapper, codec, migrator, metricsRegistry);
    }
}
