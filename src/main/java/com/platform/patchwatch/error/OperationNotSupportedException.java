package com.platform.patchwatch.error;

/**
 * The host is not in a state that allows the requested operation.
 */
public class OperationNotSupportedException extends PatchWatchException {

    public OperationNotSupportedException(String message) {
        super(ErrorCode.OPERATION_NOT_SUPPORTED, message);
    }
}
