package com.platform.patchwatch.model;

import java.util.Objects;

/**
 * A single pending package change reported by a provider.
 *
 * @param packageName    package identifier as the remote package manager prints it
 * @param currentVersion installed version, or {@code null} when the update introduces a new package
 * @param newVersion     version the package manager would install
 * @param security       whether the update addresses a vulnerability
 * @param source         repository or channel label, may be {@code null}
 */
public record Update(
    String packageName,
    String currentVersion,
    String newVersion,
    boolean security,
    String source
) {

    public Update {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(newVersion, "newVersion");
    }

    public static Update of(String packageName, String currentVersion, String newVersion, String source) {
        return new Update(packageName, currentVersion, newVersion, false, source);
    }

    /**
     * True when the package is not installed yet (pulled in as a new dependency).
     */
    public boolean isNewPackage() {
        return currentVersion == null;
    }

    public Update withSecurity(boolean security) {
        return security == this.security ? this : new Update(packageName, currentVersion, newVersion, security, source);
    }
}
