package com.platform.patchwatch.provider;

/**
 * Result of a provider step that may legitimately not run.
 *
 * @param status what happened
 * @param value  the step's result, {@code null} unless {@link Status#COMPLETED}
 * @param detail short human-readable explanation
 */
public record ProviderOutcome<T>(Status status, T value, String detail) {

    public enum Status {
        COMPLETED,
        SKIPPED_PRIVILEGED,
        NOT_REQUIRED
    }

    public static <T> ProviderOutcome<T> completed(T value) {
        return new ProviderOutcome<>(Status.COMPLETED, value, null);
    }

    public static <T> ProviderOutcome<T> skippedPrivileged(ProviderOperation operation) {
        return new ProviderOutcome<>(Status.SKIPPED_PRIVILEGED, null,
            operation + " requires sudo, which the sudo policy does not allow");
    }

    public static <T> ProviderOutcome<T> notRequired(String detail) {
        return new ProviderOutcome<>(Status.NOT_REQUIRED, null, detail);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED_PRIVILEGED;
    }
}
