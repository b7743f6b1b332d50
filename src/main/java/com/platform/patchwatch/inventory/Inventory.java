package com.platform.patchwatch.inventory;

import com.platform.patchwatch.config.PatchWatchProperties.HostDefinition;
import com.platform.patchwatch.error.HostNotFoundException;
import com.platform.patchwatch.error.OperationInProgressException;
import com.platform.patchwatch.error.OperationNotSupportedException;
import com.platform.patchwatch.error.ValidationException;
import com.platform.patchwatch.model.HostRecord;
import com.platform.patchwatch.model.HostSelection;
import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.InventorySnapshot;
import com.platform.patchwatch.model.OsDescriptor;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.observability.MetricsRegistry;
import com.platform.patchwatch.provider.ProviderKind;
import com.platform.patchwatch.state.HostState;
import com.platform.patchwatch.state.HostStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The set of managed hosts, in configuration order. Every mutation goes
 * through this class and is serialized on its monitor; readers receive
 * immutable {@link HostView} copies.
 */
@Slf4j
public class Inventory {

    public static final int SCHEMA_VERSION = 2;

    private final Map<String, Host> hosts = new LinkedHashMap<>();
    private final HostStateMachine stateMachine;
    private final MetricsRegistry metricsRegistry;
    private final AtomicLong attemptSequence = new AtomicLong();

    public Inventory(List<HostDefinition> definitions, HostStateMachine stateMachine, MetricsRegistry metricsRegistry) {
        this.stateMachine = stateMachine;
        this.metricsRegistry = metricsRegistry;
        for (HostDefinition definition : definitions) {
            validate(definition);
            if (hosts.containsKey(definition.name())) {
                throw ValidationException.duplicateHost(definition.name());
            }
            hosts.put(definition.name(), new Host(definition));
        }
        log.info("Inventory initialized with {} hosts", hosts.size());
    }

    private static void validate(HostDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw ValidationException.invalidHost("name", definition.name(), "host name must not be blank");
        }
        String address = definition.address();
        if (address == null || address.isBlank()) {
            throw ValidationException.invalidHost("address", address,
                String.format("host '%s' has no address", definition.name()));
        }
        // ssh would read these as options rather than a destination
        if (address.startsWith("-") || address.chars().anyMatch(Character::isWhitespace)) {
            throw ValidationException.invalidHost("address", address,
                String.format("host '%s' address must not start with '-' or contain whitespace", definition.name()));
        }
    }

    public synchronized int size() {
        return hosts.size();
    }

    public synchronized List<HostView> hosts() {
        return hosts.values().stream().map(Host::toView).toList();
    }

    public synchronized HostView host(String name) {
        return require(name).toView();
    }

    /**
     * Hosts matched by a selection, in inventory order.
     *
     * @throws HostNotFoundException if an explicitly named host is not configured
     */
    public synchronized List<HostView> select(HostSelection selection) {
        if (selection.all()) {
            return hosts();
        }
        for (String name : selection.names()) {
            require(name);
        }
        return hosts.values().stream()
            .filter(h -> selection.names().contains(h.getName()))
            .map(Host::toView)
            .toList();
    }

    public synchronized Attempt beginDiscovery(String name) {
        Host host = require(name);
        ensureIdle(host);
        return begin(host, HostState.DISCOVERING, "discovery requested");
    }

    /**
     * @throws OperationNotSupportedException unless the host is discovered and supported
     */
    public synchronized Attempt beginRefresh(String name) {
        Host host = require(name);
        ensureIdle(host);
        if (host.getState() != HostState.DISCOVERED) {
            throw new OperationNotSupportedException(String.format(
                "Host %s cannot be refreshed while %s", name, host.getState()));
        }
        return begin(host, HostState.REFRESHING, "refresh requested");
    }

    private Attempt begin(Host host, HostState transientState, String reason) {
        HostState from = host.getState();
        stateMachine.transition(host.getName(), from, transientState, reason);
        host.setResumeState(from);
        host.setState(transientState);
        long token = attemptSequence.incrementAndGet();
        host.setCurrentAttempt(token);
        return new Attempt(host.getName(), token, transientState);
    }

    private static void ensureIdle(Host host) {
        if (host.getState().isTransient()) {
            throw new OperationInProgressException(host.getName(), host.getState().name());
        }
    }

    /**
     * Record a successful discovery. A null provider marks the host unsupported.
     *
     * @return false if the attempt was superseded and nothing changed
     */
    public synchronized boolean commitDiscovery(Attempt attempt, OsDescriptor os, ProviderKind provider) {
        Host host = current(attempt);
        if (host == null) {
            return false;
        }
        HostState target = provider != null ? HostState.DISCOVERED : HostState.UNSUPPORTED;
        if (provider == null || provider != host.getProvider()) {
            host.clearUpdates();
        }
        finish(host, target, "discovered " + os.summary());
        host.setOs(os);
        host.setProvider(provider);
        host.setPlatformRejected(false);
        host.setOnline(true);
        return true;
    }

    /**
     * Mark a host whose shell did not answer like a POSIX system. Bulk discovery
     * skips such hosts until one is discovered explicitly.
     */
    public synchronized boolean rejectPlatform(Attempt attempt, String reason) {
        Host host = current(attempt);
        if (host == null) {
            return false;
        }
        finish(host, HostState.UNSUPPORTED, reason);
        host.clearUpdates();
        host.setOs(null);
        host.setProvider(null);
        host.setPlatformRejected(true);
        host.setOnline(true);
        return true;
    }

    /**
     * Replace the update list as one generation.
     */
    public synchronized boolean commitRefresh(Attempt attempt, List<Update> updates, Instant refreshedAt) {
        Host host = current(attempt);
        if (host == null) {
            return false;
        }
        finish(host, HostState.DISCOVERED, "refreshed " + updates.size() + " updates");
        host.setUpdates(List.copyOf(updates));
        host.setLastRefresh(refreshedAt);
        host.setOnline(true);
        return true;
    }

    /**
     * End an attempt without committing results. The host returns to the state it
     * held before; updates and last refresh stay untouched.
     *
     * @param online new reachability, or null to leave it unchanged
     */
    public synchronized boolean fail(Attempt attempt, Boolean online) {
        Host host = current(attempt);
        if (host == null) {
            return false;
        }
        finish(host, host.getResumeState(), "attempt failed");
        if (online != null) {
            host.setOnline(online);
        }
        return true;
    }

    public synchronized boolean abandon(Attempt attempt) {
        Host host = current(attempt);
        if (host == null) {
            return false;
        }
        finish(host, host.getResumeState(), "attempt abandoned");
        log.info("Abandoned {} on {}", attempt.operationState(), host.getName());
        return true;
    }

    public synchronized void recordReachability(String name, boolean online) {
        require(name).setOnline(online);
    }

    private Host current(Attempt attempt) {
        Host host = hosts.get(attempt.hostName());
        if (host == null || host.getCurrentAttempt() != attempt.token()) {
            log.debug("Discarding superseded {} result for {}", attempt.operationState(), attempt.hostName());
            metricsRegistry.recordSupersededCommit(attempt.hostName());
            return null;
        }
        return host;
    }

    private void finish(Host host, HostState target, String reason) {
        stateMachine.transition(host.getName(), host.getState(), target, reason);
        host.setState(target);
        host.setResumeState(target);
        host.setCurrentAttempt(0);
    }

    /**
     * Committed state of every host. Hosts mid-operation contribute the state
     * they held before the operation started.
     */
    public synchronized InventorySnapshot snapshot(Instant snapshotTime) {
        List<HostRecord> records = hosts.values().stream().map(Host::toRecord).toList();
        return new InventorySnapshot(SCHEMA_VERSION, snapshotTime, records);
    }

    /**
     * Load persisted host state. Records for hosts no longer configured are dropped.
     *
     * @return number of hosts restored
     */
    public synchronized int restore(InventorySnapshot snapshot) {
        int restored = 0;
        List<String> pruned = new ArrayList<>();
        for (HostRecord record : snapshot.hosts()) {
            Host host = hosts.get(record.name());
            if (host == null) {
                pruned.add(record.name());
                continue;
            }
            if (host.getState().isTransient()) {
                log.warn("Not restoring {} while an operation is in flight", record.name());
                continue;
            }
            Objects.requireNonNull(record.state(), "state");
            host.apply(record);
            restored++;
        }
        if (!pruned.isEmpty()) {
            log.info("Dropped cached hosts no longer in configuration: {}", pruned);
        }
        log.info("Restored {} of {} hosts from cache", restored, hosts.size());
        return restored;
    }

    private Host require(String name) {
        Host host = hosts.get(name);
        if (host == null) {
            throw new HostNotFoundException(name);
        }
        return host;
    }
}
