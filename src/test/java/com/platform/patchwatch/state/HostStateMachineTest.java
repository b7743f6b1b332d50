package com.platform.patchwatch.state;

import com.platform.patchwatch.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HostStateMachineTest {

    private final HostStateMachine stateMachine = new HostStateMachine(new MetricsRegistry(new SimpleMeterRegistry()));

    @Test
    void followsDiscoveryAndRefreshLifecycle() {
        assertThat(stateMachine.isTransitionAllowed(HostState.UNKNOWN, HostState.DISCOVERING)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(HostState.DISCOVERING, HostState.DISCOVERED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(HostState.DISCOVERING, HostState.UNSUPPORTED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(HostState.DISCOVERED, HostState.REFRESHING)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(HostState.REFRESHING, HostState.DISCOVERED)).isTrue();
        assertThat(stateMachine.isTransitionAllowed(HostState.UNSUPPORTED, HostState.DISCOVERING)).isTrue();
    }

    @Test
    void refreshRequiresDiscovery() {
        assertThat(stateMachine.isTransitionAllowed(HostState.UNKNOWN, HostState.REFRESHING)).isFalse();
        assertThat(stateMachine.isTransitionAllowed(HostState.UNSUPPORTED, HostState.REFRESHING)).isFalse();
    }

    @Test
    void selfTransitionIsRejected() {
        assertThat(stateMachine.isTransitionAllowed(HostState.DISCOVERED, HostState.DISCOVERED)).isFalse();
    }

    @Test
    void transitionThrowsOnIllegalMove() {
        assertThat(stateMachine.transition("web-1", HostState.UNKNOWN, HostState.DISCOVERING, "test"))
            .isEqualTo(HostState.DISCOVERING);
        assertThatThrownBy(() -> stateMachine.transition("web-1", HostState.REFRESHING, HostState.UNKNOWN, "test"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("web-1");
    }

    @Test
    void onlyInFlightStatesAreTransient() {
        assertThat(HostState.DISCOVERING.isTransient()).isTrue();
        assertThat(HostState.REFRESHING.isTransient()).isTrue();
        assertThat(HostState.DISCOVERED.isTransient()).isFalse();
        assertThat(HostState.UNKNOWN.isTransient()).isFalse();
    }
}
