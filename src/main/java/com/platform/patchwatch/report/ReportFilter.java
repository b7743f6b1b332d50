package com.platform.patchwatch.report;

import java.util.Set;

/**
 * Narrows a report to some hosts and, optionally, to security updates only.
 */
public record ReportFilter(Set<String> hosts, boolean securityOnly) {

    public ReportFilter {
        hosts = hosts == null ? Set.of() : Set.copyOf(hosts);
    }

    public static ReportFilter everything() {
        return new ReportFilter(Set.of(), false);
    }

    public static ReportFilter securityUpdatesOnly() {
        return new ReportFilter(Set.of(), true);
    }

    public boolean includes(String host) {
        return hosts.isEmpty() || hosts.contains(host);
    }
}
