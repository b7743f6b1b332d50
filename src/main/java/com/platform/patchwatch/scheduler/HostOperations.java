package com.platform.patchwatch.scheduler;

import com.platform.patchwatch.config.OperationContext;
import com.platform.patchwatch.core.RetryEngine;
import com.platform.patchwatch.error.ConnectionException;
import com.platform.patchwatch.error.ErrorKind;
import com.platform.patchwatch.error.OperationInProgressException;
import com.platform.patchwatch.error.OperationNotSupportedException;
import com.platform.patchwatch.error.PatchWatchException;
import com.platform.patchwatch.error.PrivilegeException;
import com.platform.patchwatch.error.UnsupportedPlatformException;
import com.platform.patchwatch.inventory.Attempt;
import com.platform.patchwatch.inventory.Inventory;
import com.platform.patchwatch.model.HostResult;
import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.Operation;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.model.Update;
import com.platform.patchwatch.policy.SudoPolicyResolver;
import com.platform.patchwatch.provider.PlatformDetector;
import com.platform.patchwatch.provider.ProviderOperation;
import com.platform.patchwatch.provider.ProviderOutcome;
import com.platform.patchwatch.provider.ProviderRegistry;
import com.platform.patchwatch.provider.UpdateProvider;
import com.platform.patchwatch.state.HostState;
import com.platform.patchwatch.transport.TransportFactory;
import com.platform.patchwatch.transport.TransportSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Single-host discovery, refresh and ping. Every failure is turned into a
 * {@link HostResult}; nothing thrown here escapes to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HostOperations {

    static final String PING_COMMAND = "true";

    private final Inventory inventory;
    private final TransportFactory transportFactory;
    private final ProviderRegistry providerRegistry;
    private final PlatformDetector platformDetector;
    private final SudoPolicyResolver sudoPolicyResolver;
    private final RetryEngine retryEngine;
    private final Clock clock;

    public HostResult discover(HostView host, OperationContext context, Consumer<Attempt> attemptSink) {
        String name = host.name();
        Attempt attempt;
        try {
            attempt = inventory.beginDiscovery(name);
        } catch (PatchWatchException e) {
            return rejected(name, Operation.DISCOVER, e);
        }
        attemptSink.accept(attempt);

        try (TransportSession session = connect(host, context)) {
            PlatformDetector.Detection detection = platformDetector.detect(session);
            if (!inventory.commitDiscovery(attempt, detection.os(), detection.provider())) {
                return HostResult.cancelled(name, Operation.DISCOVER);
            }
            if (!detection.isSupported()) {
                log.info("{} is unsupported: {}", name, detection.os().summary());
                return HostResult.ok(name, Operation.DISCOVER,
                    "Unsupported platform " + detection.os().summary());
            }
            log.info("Discovered {}: {} via {}", name, detection.os().summary(), detection.provider().getId());
            return HostResult.ok(name, Operation.DISCOVER,
                detection.os().summary() + " via " + detection.provider().getId());
        } catch (UnsupportedPlatformException e) {
            log.warn("Rejecting {}: {}", name, e.getMessage());
            inventory.rejectPlatform(attempt, e.getMessage());
            return HostResult.failed(name, Operation.DISCOVER, e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            inventory.fail(attempt, reachabilityAfter(e));
            return failure(name, Operation.DISCOVER, e, List.of());
        }
    }

    /**
     * @param skipUnsupported report unsupported hosts as skipped rather than failed
     */
    public HostResult refresh(HostView host, boolean sync, boolean skipUnsupported,
                              OperationContext context, Consumer<Attempt> attemptSink) {
        String name = host.name();
        Attempt attempt;
        try {
            attempt = inventory.beginRefresh(name);
        } catch (OperationNotSupportedException e) {
            if (skipUnsupported && host.state() == HostState.UNSUPPORTED) {
                return HostResult.skipped(name, Operation.REFRESH, "Unsupported platform");
            }
            return rejected(name, Operation.REFRESH, e);
        } catch (PatchWatchException e) {
            return rejected(name, Operation.REFRESH, e);
        }
        attemptSink.accept(attempt);

        HostView current = inventory.host(name);
        List<String> warnings = new ArrayList<>();
        try {
            UpdateProvider provider = providerRegistry.get(current.provider());
            SudoPolicy policy = sudoPolicyResolver.effectivePolicy(current, context.globalSudoPolicy());
            if (!sudoPolicyResolver.canRefresh(current, provider, context.globalSudoPolicy())) {
                throw new PrivilegeException(ProviderOperation.FETCH_UPDATES, String.format(
                    "Querying %s updates needs sudo, sudo policy is %s", provider.kind().getId(), policy));
            }

            try (TransportSession session = connect(current, context)) {
                if (sync) {
                    syncRepositories(current, provider, policy, session, context, warnings);
                }
                ProviderOutcome<List<Update>> outcome = provider.fetchUpdates(session, policy);
                if (!outcome.isCompleted()) {
                    throw new PrivilegeException(ProviderOperation.FETCH_UPDATES, outcome.detail());
                }
                List<Update> updates = outcome.value();
                if (!inventory.commitRefresh(attempt, updates, clock.instant())) {
                    return HostResult.cancelled(name, Operation.REFRESH);
                }
                long security = updates.stream().filter(Update::security).count();
                log.info("Refreshed {}: {} updates ({} security)", name, updates.size(), security);
                return HostResult.ok(name, Operation.REFRESH,
                    String.format("%d updates, %d security", updates.size(), security), warnings);
            }
        } catch (RuntimeException e) {
            inventory.fail(attempt, reachabilityAfter(e));
            return failure(name, Operation.REFRESH, e, warnings);
        }
    }

    private void syncRepositories(HostView host, UpdateProvider provider, SudoPolicy policy,
                                  TransportSession session, OperationContext context, List<String> warnings) {
        if (!sudoPolicyResolver.canSync(host, provider, context.globalSudoPolicy())) {
            String warning = String.format("Repository sync skipped: needs sudo, sudo policy is %s", policy);
            log.info("{}: {}", host.name(), warning);
            warnings.add(warning);
            return;
        }
        ProviderOutcome<Void> outcome = provider.syncRepositories(session, policy);
        switch (outcome.status()) {
            case SKIPPED_PRIVILEGED -> warnings.add("Repository sync skipped: " + outcome.detail());
            case NOT_REQUIRED -> log.debug("{}: sync not required ({})", host.name(), outcome.detail());
            case COMPLETED -> log.debug("{}: repositories synchronized", host.name());
        }
    }

    /**
     * Binary reachability probe; the cause of a failure is only logged.
     * Any failure, expected or not, leaves the host offline.
     */
    public HostResult ping(HostView host, OperationContext context) {
        boolean online;
        try (TransportSession session = transportFactory.open(host, context.pingTimeout(), context.pingTimeout())) {
            online = session.run(PING_COMMAND, context.pingTimeout()).succeeded();
        } catch (PatchWatchException e) {
            log.info("Ping to {} failed: {}", host.name(), e.getMessage());
            online = false;
        } catch (RuntimeException e) {
            log.warn("Ping to {} failed unexpectedly", host.name(), e);
            online = false;
        }
        inventory.recordReachability(host.name(), online);
        return online
            ? HostResult.ok(host.name(), Operation.PING, "online")
            : HostResult.failed(host.name(), Operation.PING, ErrorKind.OFFLINE, "offline");
    }

    public boolean abandon(Attempt attempt) {
        return inventory.abandon(attempt);
    }

    private TransportSession connect(HostView host, OperationContext context) {
        return retryEngine.executeWithRetry("connect", host.name(), () ->
            transportFactory.open(host, context.connectTimeoutFor(host), context.commandTimeoutFor(host)));
    }

    private static Boolean reachabilityAfter(RuntimeException e) {
        // an interrupted command says nothing about the host
        if (Thread.currentThread().isInterrupted()) {
            return null;
        }
        return e instanceof ConnectionException ? Boolean.FALSE : null;
    }

    private static HostResult rejected(String name, Operation operation, PatchWatchException e) {
        log.info("{} on {} rejected: {}", operation, name, e.getMessage());
        return HostResult.failed(name, operation, e.getErrorKind(), e.getMessage());
    }

    private static HostResult failure(String name, Operation operation, RuntimeException e, List<String> warnings) {
        if (e instanceof PatchWatchException pwe) {
            log.warn("{} on {} failed: {}", operation, name, e.getMessage());
            return HostResult.failed(name, operation, pwe.getErrorKind(), e.getMessage(), warnings);
        }
        log.error("{} on {} failed unexpectedly", operation, name, e);
        return HostResult.failed(name, operation, ErrorKind.INTERNAL,
            e.getClass().getSimpleName() + ": " + e.getMessage(), warnings);
    }
}
