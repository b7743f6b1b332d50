package com.platform.patchwatch.report;

import com.platform.patchwatch.model.OsDescriptor;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.state.HostState;

import java.time.Instant;
import java.util.List;

public record HostReport(
    String name,
    String address,
    String description,
    OsDescriptor os,
    ProviderKind provider,
    HostState state,
    boolean online,
    Instant lastRefresh,
    boolean stale,
    List<Update> updates,
    int updateCount,
    int securityCount
) {

    public HostReport {
        updates = List.copyOf(updates);
    }
}
