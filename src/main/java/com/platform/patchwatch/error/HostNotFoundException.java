package com.platform.patchwatch.error;

/**
 * Raised when a selection names a host the inventory does not know.
 */
public class HostNotFoundException extends PatchWatchException {

    private final String hostName;

    public HostNotFoundException(String hostName) {
        super(ErrorCode.HOST_NOT_FOUND, String.format("Host not found: %s", hostName));
        this.hostName = hostName;
    }

    public String getHostName() {
        return hostName;
    }
}
