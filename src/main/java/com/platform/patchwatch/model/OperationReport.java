package com.platform.patchwatch.model;

import java.time.Duration;
import java.util.List;

/**
 * Mixed per-host result set of one fleet operation, in inventory order.
 */
public record OperationReport(Operation operation, List<HostResult> results, Duration elapsed) {

    public OperationReport {
        results = List.copyOf(results);
    }

    public long successCount() {
        return results.stream().filter(HostResult::isOk).count();
    }

    public long failureCount() {
        return results.stream().filter(HostResult::isFailed).count();
    }

    public List<HostResult> failures() {
        return results.stream().filter(HostResult::isFailed).toList();
    }
}
