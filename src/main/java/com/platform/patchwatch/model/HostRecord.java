package com.platform.patchwatch.model;

import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.state.HostState;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of a host. Holds only committed state: transient
 * lifecycle states never appear here.
 */
public record HostRecord(
    String name,
    String address,
    int port,
    String username,
    String description,
    HostState state,
    OsDescriptor os,
    ProviderKind provider,
    boolean platformRejected,
    boolean online,
    Instant lastRefresh,
    List<Update> updates
) {

    public HostRecord {
        updates = updates == null ? List.of() : List.copyOf(updates);
    }
}
