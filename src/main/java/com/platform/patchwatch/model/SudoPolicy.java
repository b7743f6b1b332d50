package com.platform.patchwatch.model;

import java.util.Locale;

/**
 * Whether privileged commands may run unattended on a host.
 */
public enum SudoPolicy {
    /**
     * Never elevate; privileged steps are skipped.
     */
    SKIP,

    /**
     * Elevate with {@code sudo -n}, relying on a NOPASSWD sudoers entry.
     */
    NOPASSWD;

    public static SudoPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return SudoPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
