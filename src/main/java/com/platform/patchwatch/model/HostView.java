package com.platform.patchwatch.model;

import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.state.HostState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Immutable, point-in-time copy of a host as held by the inventory.
 * Handed to schedulers, providers and controllers so nothing outside the
 * inventory can mutate live host state.
 */
public record HostView(
    String name,
    String address,
    int port,
    String username,
    String description,
    SudoPolicy sudoPolicy,
    Duration connectTimeout,
    Duration commandTimeout,
    HostState state,
    OsDescriptor os,
    ProviderKind provider,
    boolean platformRejected,
    boolean online,
    Instant lastRefresh,
    List<Update> updates
) {

    public HostView {
        updates = updates == null ? List.of() : List.copyOf(updates);
    }

    public boolean isBusy() {
        return state.isTransient();
    }
}
