package com.platform.patchwatch.error;

/**
 * The remote system did not answer like a POSIX host.
 */
public class UnsupportedPlatformException extends PatchWatchException {

    public UnsupportedPlatformException(String message) {
        super(ErrorCode.UNSUPPORTED_PLATFORM, message);
    }
}
