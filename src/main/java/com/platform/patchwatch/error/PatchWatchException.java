package com.platform.patchwatch.error;

/**
 * Base exception for all PatchWatch exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class PatchWatchException extends RuntimeException {

    private final ErrorCode errorCode;

    protected PatchWatchException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected PatchWatchException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected PatchWatchException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorKind getErrorKind() {
        return errorCode.getKind();
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
