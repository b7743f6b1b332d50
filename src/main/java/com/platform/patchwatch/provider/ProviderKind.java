package com.platform.patchwatch.provider;

import java.util.Locale;
import java.util.Optional;

/**
 * Package manager families with a provider implementation.
 */
public enum ProviderKind {
    APT("apt", "Debian and Ubuntu (apt-get)"),
    DNF("dnf", "Fedora and RHEL 8+ family (dnf)"),
    YUM("yum", "RHEL 7 and older family (yum)"),
    PKG("pkg", "FreeBSD (pkg)"),
    PKG_ADD("pkg_add", "OpenBSD (pkg_add)");

    private final String id;
    private final String description;

    ProviderKind(String id, String description) {
        this.id = id;
        this.description = description;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolve a lower-case identifier as used in cache files and the API.
     */
    public static Optional<ProviderKind> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ProviderKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
