package com.platform.patchwatch.error;

/**
 * Failure classification attached to a per-host operation result.
 */
public enum ErrorKind {
    CONNECTION,
    AUTHENTICATION,
    UNSUPPORTED_PLATFORM,
    PRIVILEGE,
    PARSE,
    COMMAND_FAILED,
    OPERATION_NOT_SUPPORTED,
    OPERATION_IN_PROGRESS,
    CANCELLED,
    OFFLINE,
    INTERNAL
}
