package com.platform.patchwatch.lifecycle;

import com.platform.patchwatch.config.PatchWatchProperties;
import com.platform.patchwatch.inventory.InventoryService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Restores the inventory from the cache at startup. On shutdown, cancels
 * running operations and saves the last committed state.
 */
@Slf4j
@Component
public class InventoryLifecycleManager implements ApplicationListener<ContextClosedEvent> {

    private static final Duration SETTLE_MARGIN = Duration.ofSeconds(2);
    private static final long POLL_MS = 100;

    private final InventoryService inventoryService;
    private final PatchWatchProperties properties;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public InventoryLifecycleManager(InventoryService inventoryService, PatchWatchProperties properties) {
        this.inventoryService = inventoryService;
        this.properties = properties;
    }

    @PostConstruct
    public void restore() {
        int restored = inventoryService.loadCache(properties.cache().onCorruption());
        log.info("Startup restore complete: {} host(s) from {}", restored, properties.cache().file());
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        shutdown();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        Instant start = Instant.now();
        log.info("Shutting down inventory");

        if (inventoryService.cancel() > 0) {
            waitForRunningOperations(properties.cancelGracePeriod().plus(SETTLE_MARGIN));
        }
        if (properties.cache().autosave()) {
            inventoryService.save();
        }
        log.info("Inventory shutdown complete ({} ms)", Duration.between(start, Instant.now()).toMillis());
    }

    private void waitForRunningOperations(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inventoryService.isBusy() && System.nanoTime() < deadline) {
            try {
                Thread.sleep(POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for operations to stop");
                return;
            }
        }
        if (inventoryService.isBusy()) {
            log.warn("Operations still running after {}s; saving committed state anyway", timeout.toSeconds());
        }
    }
}
