package com.platform.patchwatch.provider;

/**
 * Remote steps a provider performs.
 */
public enum ProviderOperation {
    SYNC_REPOSITORIES,
    FETCH_UPDATES,
    FETCH_SECURITY_UPDATES
}
