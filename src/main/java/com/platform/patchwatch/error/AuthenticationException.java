package com.platform.patchwatch.error;

/**
 * Key rejected by the remote host or no usable agent identity.
 */
public class AuthenticationException extends PatchWatchException {

    private final String hostName;

    public AuthenticationException(String hostName, String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message);
        this.hostName = hostName;
    }

    public String getHostName() {
        return hostName;
    }
}
