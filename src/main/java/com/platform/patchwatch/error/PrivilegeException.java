package com.platform.patchwatch.error;

import com.platform.patchwatch.provider.ProviderOperation;

/**
 * Elevation required for an operation but the effective sudo policy forbids it.
 */
public class PrivilegeException extends PatchWatchException {

    private final ProviderOperation operation;

    public PrivilegeException(ProviderOperation operation, String message) {
        super(ErrorCode.PRIVILEGE_REQUIRED, message);
        this.operation = operation;
    }

    public ProviderOperation getOperation() {
        return operation;
    }
}
