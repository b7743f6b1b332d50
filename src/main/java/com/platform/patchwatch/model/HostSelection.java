package com.platform.patchwatch.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Which hosts an operation targets: either the whole inventory or an explicit set of names.
 */
public record HostSelection(boolean all, Set<String> names) {

    public HostSelection {
        names = names == null ? Set.of() : Set.copyOf(names);
    }

    public static HostSelection allHosts() {
        return new HostSelection(true, Set.of());
    }

    public static HostSelection of(String... names) {
        return of(List.of(names));
    }

    /**
     * An empty or null list selects every host.
     */
    public static HostSelection of(List<String> names) {
        if (names == null || names.isEmpty()) {
            return allHosts();
        }
        return new HostSelection(false, new LinkedHashSet<>(names));
    }

    public boolean isExplicit(String name) {
        return !all && names.contains(name);
    }
}
