package com.platform.patchwatch.cache;

/**
 * What to do when the cache file cannot be read at startup.
 */
public enum CorruptionPolicy {
    /**
     * Refuse to start; the operator clears the file and rediscovers.
     */
    ABORT,

    /**
     * Move the broken file aside and start from an empty inventory.
     */
    RESET
}
