package com.platform.patchwatch.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Whole-inventory state as written to and read from the cache.
 */
public record InventorySnapshot(int schemaVersion, Instant snapshotTime, List<HostRecord> hosts) {

    public InventorySnapshot {
        hosts = hosts == null ? List.of() : List.copyOf(hosts);
    }

    public Optional<HostRecord> host(String name) {
        return hosts.stream().filter(h -> h.name().equals(name)).findFirst();
    }
}
