package com.platform.patchwatch.model;

import com.platform.patchwatch.error.ErrorKind;

import java.util.List;

/**
 * Outcome of one operation against one host.
 */
public record HostResult(
    String host,
    Operation operation,
    Status status,
    ErrorKind errorKind,
    String message,
    List<String> warnings
) {

    public enum Status {
        OK,
        FAILED,
        SKIPPED
    }

    public HostResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static HostResult ok(String host, Operation operation, String message) {
        return new HostResult(host, operation, Status.OK, null, message, List.of());
    }

    public static HostResult ok(String host, Operation operation, String message, List<String> warnings) {
        return new HostResult(host, operation, Status.OK, null, message, warnings);
    }

    public static HostResult failed(String host, Operation operation, ErrorKind kind, String message) {
        return new HostResult(host, operation, Status.FAILED, kind, message, List.of());
    }

    public static HostResult failed(String host, Operation operation, ErrorKind kind, String message, List<String> warnings) {
        return new HostResult(host, operation, Status.FAILED, kind, message, warnings);
    }

    public static HostResult skipped(String host, Operation operation, String message) {
        return new HostResult(host, operation, Status.SKIPPED, null, message, List.of());
    }

    public static HostResult cancelled(String host, Operation operation) {
        return failed(host, operation, ErrorKind.CANCELLED, "Operation cancelled before completion");
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
