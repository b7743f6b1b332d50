package com.platform.patchwatch.inventory;

import com.platform.patchwatch.config.PatchWatchProperties.HostDefinition;
import com.platform.patchwatch.model.HostRecord;
import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.OsDescriptor;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.state.HostState;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Live host entity. Only {@link Inventory} mutates it, under its monitor.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
class Host {

    private final String name;
    private final String address;
    private final int port;
    private final String username;
    private final String description;
    private final SudoPolicy sudoPolicy;
    private final Duration connectTimeout;
    private final Duration commandTimeout;

    private HostState state = HostState.UNKNOWN;
    // state to return to when the in-flight attempt ends without committing
    private HostState resumeState = HostState.UNKNOWN;
    private long currentAttempt;
    private OsDescriptor os;
    private ProviderKind provider;
    private boolean platformRejected;
    private boolean online;
    private Instant lastRefresh;
    private List<Update> updates = List.of();

    Host(HostDefinition definition) {
        this.name = definition.name();
        this.address = definition.address();
        this.port = definition.port() > 0 ? definition.port() : 22;
        this.username = definition.username();
        this.description = definition.description();
        this.sudoPolicy = definition.sudoPolicy();
        this.connectTimeout = definition.connectTimeout();
        this.commandTimeout = definition.commandTimeout();
    }

    /**
     * The committed state: the state held before any in-flight attempt.
     */
    HostState stableState() {
        return state.isTransient() ? resumeState : state;
    }

    void clearUpdates() {
        this.updates = List.of();
        this.lastRefresh = null;
    }

    HostView toView() {
        return new HostView(name, address, port, username, description, sudoPolicy,
            connectTimeout, commandTimeout, state, os, provider, platformRejected,
            online, lastRefresh, updates);
    }

    HostRecord toRecord() {
        return new HostRecord(name, address, port, username, description, stableState(),
            os, provider, platformRejected, online, lastRefresh, updates);
    }

    void apply(HostRecord record) {
        this.state = record.state();
        this.resumeState = record.state();
        this.os = record.os();
        this.provider = record.provider();
        this.platformRejected = record.platformRejected();
        this.online = record.online();
        this.lastRefresh = record.lastRefresh();
        this.updates = record.lastRefresh() == null ? List.of() : record.updates();
    }
}
