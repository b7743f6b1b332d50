package com.platform.patchwatch.inventory;

import com.platform.patchwatch.cache.CacheStore;
import com.platform.patchwatch.cache.CorruptionPolicy;
import com.platform.patchwatch.config.PatchWatchProperties;
import com.platform.patchwatch.error.CacheCorruptionException;
import com.platform.patchwatch.error.CacheWriteException;
import com.platform.patchwatch.model.HostSelection;
import com.platform.patchwatch.model.HostView;
import com.platform.patchwatch.model.InventorySnapshot;
import com.platform.patchwatch.model.OperationReport;
import com.platform.patchwatch.scheduler.RefreshScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for fleet operations. Resolves selections against the
 * inventory, runs them through the scheduler and persists the outcome.
 */
@Slf4j
@Service
public class InventoryService {

    private final Inventory inventory;
    private final RefreshScheduler scheduler;
    private final CacheStore cacheStore;
    private final boolean autosave;
    private final Clock clock;

    @Autowired
    public InventoryService(Inventory inventory, RefreshScheduler scheduler, CacheStore cacheStore,
                            PatchWatchProperties properties, Clock clock) {
        this(inventory, scheduler, cacheStore, properties.cache().autosave(), clock);
    }

    InventoryService(Inventory inventory, RefreshScheduler scheduler, CacheStore cacheStore,
                     boolean autosave, Clock clock) {
        this.inventory = inventory;
        this.scheduler = scheduler;
        this.cacheStore = cacheStore;
        this.autosave = autosave;
        this.clock = clock;
    }

    public OperationReport discover(HostSelection selection) {
        OperationReport report = scheduler.discover(inventory.select(selection), selection);
        autosave();
        return report;
    }

    public OperationReport refresh(HostSelection selection, boolean sync) {
        OperationReport report = scheduler.refresh(inventory.select(selection), selection, sync);
        autosave();
        return report;
    }

    public OperationReport ping(HostSelection selection) {
        OperationReport report = scheduler.ping(inventory.select(selection));
        autosave();
        return report;
    }

    public int cancel() {
        return scheduler.cancel();
    }

    public boolean isBusy() {
        return scheduler.isBusy();
    }

    public List<HostView> hosts() {
        return inventory.hosts();
    }

    public HostView host(String name) {
        return inventory.host(name);
    }

    public void save() {
        InventorySnapshot snapshot = inventory.snapshot(clock.instant());
        cacheStore.save(snapshot);
        log.info("Saved inventory of {} hosts to {}", snapshot.hosts().size(), cacheStore.file());
    }

    /**
     * Restore host state from the cache.
     *
     * @return number of hosts restored
     * @throws CacheCorruptionException when the cache is unreadable and the policy is ABORT
     */
    public int loadCache(CorruptionPolicy onCorruption) {
        Optional<InventorySnapshot> snapshot;
        try {
            snapshot = cacheStore.loadAndUpgrade();
        } catch (CacheCorruptionException e) {
            if (onCorruption == CorruptionPolicy.ABORT) {
                log.error("{}; to recover, {}", e.getMessage(), e.getRemedialAction());
                throw e;
            }
            Optional<Path> movedTo = cacheStore.quarantine();
            log.warn("{}; starting from an empty inventory (broken file kept at {})",
                e.getMessage(), movedTo.map(Object::toString).orElse("<gone>"));
            return 0;
        }
        return snapshot.map(inventory::restore).orElse(0);
    }

    private void autosave() {
        if (!autosave) {
            return;
        }
        try {
            save();
        } catch (CacheWriteException e) {
            log.error("Autosave failed, results are kept in memory only: {}", e.getMessage(), e);
        }
    }
}
