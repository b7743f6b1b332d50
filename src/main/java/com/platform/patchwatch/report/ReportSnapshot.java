package com.platform.patchwatch.report;

import java.time.Instant;
import java.util.List;

/**
 * Report over the cached inventory.
 *
 * @param snapshotTime when the cached snapshot was written, null without a cache
 * @param generatedAt  when this report was built
 */
public record ReportSnapshot(Instant snapshotTime, Instant generatedAt, boolean securityOnly,
                             List<HostReport> hosts) {

    public ReportSnapshot {
        hosts = List.copyOf(hosts);
    }

    public int totalUpdates() {
        return hosts.stream().mapToInt(HostReport::updateCount).sum();
    }

    public int totalSecurityUpdates() {
        return hosts.stream().mapToInt(HostReport::securityCount).sum();
    }

    public long staleHosts() {
        return hosts.stream().filter(HostReport::stale).count();
    }
}
