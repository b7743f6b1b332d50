package com.platform.patchwatch.model;

/**
 * Fleet operations exposed to callers.
 */
public enum Operation {
    DISCOVER,
    REFRESH,
    PING
}
