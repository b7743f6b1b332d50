package com.platform.patchwatch.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.patchwatch.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.ZoneOffset;

public final class TestCacheStores {

    private TestCacheStores() {
    }

    /**
     * A store at the given path that reads zone-less legacy timestamps as UTC.
     */
    public static CacheStore at(Path file) {
        ObjectMapper mapper = new ObjectMapper();
        return new CacheStore(file, mapper, new SnapshotCodec(mapper), new SnapshotMigrator(ZoneOffset.UTC),
            new MetricsRegistry(new SimpleMeterRegistry()));
    }
}
