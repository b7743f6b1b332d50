package com.platform.patchwatch.error;

/**
 * Host unreachable, connection refused or connect timeout.
 */
public class ConnectionException extends PatchWatchException {

    private final String hostName;

    public ConnectionException(String hostName, String message) {
        super(ErrorCode.CONNECTION_FAILED, message);
        this.hostName = hostName;
    }

    public ConnectionException(String hostName, String message, Throwable cause) {
        super(ErrorCode.CONNECTION_FAILED, message, cause);
        this.hostName = hostName;
    }

    private ConnectionException(ErrorCode errorCode, String hostName, String message) {
        super(errorCode, message);
        this.hostName = hostName;
    }

    public static ConnectionException timeout(String hostName, String message) {
        return new ConnectionException(ErrorCode.CONNECTION_TIMEOUT, hostName, message);
    }

    public String getHostName() {
        return hostName;
    }

    public boolean isTimeout() {
        return getErrorCode() == ErrorCode.CONNECTION_TIMEOUT;
    }
}
