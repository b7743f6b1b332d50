package com.platform.patchwatch.inventory;

import com.platform.patchwatch.config.PatchWatchProperties.HostDefinition;
import com.platform.patchwatch.model.SudoPolicy;
import com.platform.patchwatch.observability.MetricsRegistry;
import com.platform.patchwatch.state.HostStateMachine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Arrays;
import java.util.List;

/**
 * Builders shared by tests that need a populated inventory.
 */
public final class TestHosts {

    private TestHosts() {
    }

    public static HostDefinition host(String name) {
        return new HostDefinition(name, name + ".example.net", 22, "ops", null, null, null, null);
    }

    public static HostDefinition host(String name, SudoPolicy sudoPolicy) {
        return new HostDefinition(name, name + ".example.net", 22, "ops", null, sudoPolicy, null, null);
    }

    public static MetricsRegistry metrics() {
        return new MetricsRegistry(new SimpleMeterRegistry());
    }

    public static Inventory inventory(HostDefinition... hosts) {
        MetricsRegistry metrics = metrics();
        return new Inventory(Arrays.asList(hosts), new HostStateMachine(metrics), metrics);
    }

    public static Inventory inventoryOf(List<String> names) {
        return inventory(names.stream().map(TestHosts::host).toArray(HostDefinition[]::new));
    }
}
