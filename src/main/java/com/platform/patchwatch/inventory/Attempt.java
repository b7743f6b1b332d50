package com.platform.patchwatch.inventory;

import com.platform.patchwatch.state.HostState;

/**
 * Token for one in-flight discovery or refresh. A commit carrying a token that
 * is no longer current for its host is discarded.
 */
public record Attempt(String hostName, long token, HostState operationState) {
}
