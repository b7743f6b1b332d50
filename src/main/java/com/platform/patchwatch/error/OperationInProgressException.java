package com.platform.patchwatch.error;

/**
 * Another discovery or refresh already owns the host.
 */
public class OperationInProgressException extends PatchWatchException {

    public OperationInProgressException(String hostName, String state) {
        super(ErrorCode.OPERATION_IN_PROGRESS,
            String.format("Host %s is busy (%s), request rejected", hostName, state));
    }
}
