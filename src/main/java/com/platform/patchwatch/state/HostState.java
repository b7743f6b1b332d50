package com.platform.patchwatch.state;

/**
 * Lifecycle states of a managed host.
 */
public enum HostState {
    UNKNOWN("Not yet discovered", false),
    DISCOVERING("Platform detection in progress", true),
    DISCOVERED("Platform and provider known", false),
    UNSUPPORTED("No provider available for this platform", false),
    REFRESHING("Update query in progress", true);

    private final String description;
    private final boolean transientState;

    HostState(String description, boolean transientState) {
        this.description = description;
        this.transientState = transientState;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Transient states mark an in-flight operation and are never persisted.
     */
    public boolean isTransient() {
        return transientState;
    }
}
