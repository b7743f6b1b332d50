package com.platform.patchwatch.state;

import com.platform.patchwatch.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Validates and records host lifecycle transitions.
 * Holds no host state itself; the inventory owns hosts and asks here before moving one.
 */
@Slf4j
@Component
public class HostStateMachine {

    private static final Map<HostState, Set<HostState>> ALLOWED_TRANSITIONS = Map.of(
        HostState.UNKNOWN, Set.of(HostState.DISCOVERING),
        HostState.DISCOVERING, Set.of(HostState.DISCOVERED, HostState.UNSUPPORTED, HostState.UNKNOWN),
        HostState.DISCOVERED, Set.of(HostState.DISCOVERING, HostState.REFRESHING),
        HostState.REFRESHING, Set.of(HostState.DISCOVERED),
        HostState.UNSUPPORTED, Set.of(HostState.DISCOVERING)
    );

    private final MetricsRegistry metricsRegistry;

    public HostStateMachine(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    public boolean isTransitionAllowed(HostState from, HostState to) {
        if (from == to) {
            return false;
        }
        Set<HostState> allowedTargets = ALLOWED_TRANSITIONS.get(from);
        return allowedTargets != null && allowedTargets.contains(to);
    }

    /**
     * Checks a transition and records it.
     *
     * @return the target state
     * @throws IllegalStateException if the transition is not part of the lifecycle
     */
    public HostState transition(String hostName, HostState from, HostState to, String reason) {
        if (!isTransitionAllowed(from, to)) {
            log.warn("Invalid state transition rejected: {} -> {} for host: {}", from, to, hostName);
            metricsRegistry.incrementInvalidTransitions(hostName);
            throw new IllegalStateException(
                String.format("Illegal transition %s -> %s for host %s", from, to, hostName));
        }

        log.debug("State transition: {} -> {} for {} (reason: {})", from, to, hostName, reason);
        metricsRegistry.recordStateTransition(from, to);
        return to;
    }
}
