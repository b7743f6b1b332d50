package com.platform.patchwatch.report;

import com.platform.patchwatch.cache.CacheStore;
import com.platform.patchwatch.config.OperationContext;
import com.platform.patchwatch.error.HostNotFoundException;
import com.platform.patchwatch.model.HostRecord;
import com.platform.patchwatch.model.InventorySnapshot;
import com.platform.patchwatch.model.Update;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Builds reports from the cache file alone; it never contacts hosts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportService {

    private final CacheStore cacheStore;
    private final OperationContext context;
    private final Clock clock;

    public ReportSnapshot snapshot(ReportFilter filter) {
        Instant now = clock.instant();
        InventorySnapshot cached = cacheStore.load()
            .orElseGet(() -> new InventorySnapshot(0, null, List.of()));

        for (String requested : filter.hosts()) {
            if (cached.host(requested).isEmpty()) {
                throw new HostNotFoundException(requested);
            }
        }

        List<HostReport> hosts = cached.hosts().stream()
            .filter(h -> filter.includes(h.name()))
            .map(h -> toReport(h, filter.securityOnly(), now))
            .toList();
        log.debug("Built report over {} hosts (securityOnly={})", hosts.size(), filter.securityOnly());
        return new ReportSnapshot(cached.snapshotTime(), now, filter.securityOnly(), hosts);
    }

    private HostReport toReport(HostRecord host, boolean securityOnly, Instant now) {
        List<Update> updates = securityOnly
            ? host.updates().stream().filter(Update::security).toList()
            : host.updates();
        int securityCount = (int) host.updates().stream().filter(Update::security).count();
        return new HostReport(
            host.name(),
            host.address(),
            host.description(),
            host.os(),
            host.provider(),
            host.state(),
            host.online(),
            host.lastRefresh(),
            isStale(host.lastRefresh(), now, context.staleThreshold()),
            updates,
            updates.size(),
            securityCount);
    }

    static boolean isStale(Instant lastRefresh, Instant now, Duration threshold) {
        return lastRefresh == null || Duration.between(lastRefresh, now).compareTo(threshold) > 0;
    }
}
