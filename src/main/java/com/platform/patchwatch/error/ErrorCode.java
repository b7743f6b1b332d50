package com.platform.patchwatch.error;

/**
 * Standardized error codes for PatchWatch.
 * Each error has a unique code that clients can use to take specific actions.
 *
 * Format: PW-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors
 * - 2xx: Transport errors (connect, authenticate, run)
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: Platform and provider errors
 * - 5xx: Cache errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("PW-100", "Validation error", ErrorCategory.RECOVERABLE, ErrorKind.INTERNAL),
    INVALID_REQUEST("PW-101", "Invalid request format", ErrorCategory.RECOVERABLE, ErrorKind.INTERNAL),
    DUPLICATE_HOST("PW-102", "Duplicate host name", ErrorCategory.RECOVERABLE, ErrorKind.INTERNAL),

    // ==================== Transport Errors (2xx) ====================

    CONNECTION_FAILED("PW-200", "Host unreachable", ErrorCategory.RECOVERABLE, ErrorKind.CONNECTION),
    CONNECTION_TIMEOUT("PW-201", "Connection timed out", ErrorCategory.RECOVERABLE, ErrorKind.CONNECTION),
    AUTHENTICATION_FAILED("PW-210", "Authentication rejected", ErrorCategory.RECOVERABLE, ErrorKind.AUTHENTICATION),
    COMMAND_FAILED("PW-220", "Remote command failed", ErrorCategory.RECOVERABLE, ErrorKind.COMMAND_FAILED),
    COMMAND_TIMEOUT("PW-221", "Remote command timed out", ErrorCategory.RECOVERABLE, ErrorKind.COMMAND_FAILED),

    // ==================== Resource Errors (3xx) ====================

    HOST_NOT_FOUND("PW-300", "Host not found", ErrorCategory.RECOVERABLE, ErrorKind.INTERNAL),
    OPERATION_IN_PROGRESS("PW-310", "Operation already in progress for host", ErrorCategory.RECOVERABLE, ErrorKind.OPERATION_IN_PROGRESS),

    // ==================== Platform Errors (4xx) ====================

    UNSUPPORTED_PLATFORM("PW-400", "Unsupported platform", ErrorCategory.RECOVERABLE, ErrorKind.UNSUPPORTED_PLATFORM),
    PRIVILEGE_REQUIRED("PW-410", "Elevation required but forbidden by sudo policy", ErrorCategory.RECOVERABLE, ErrorKind.PRIVILEGE),
    OUTPUT_PARSE_FAILED("PW-420", "Provider output did not match expected format", ErrorCategory.RECOVERABLE, ErrorKind.PARSE),
    OPERATION_NOT_SUPPORTED("PW-430", "Operation not supported for host", ErrorCategory.RECOVERABLE, ErrorKind.OPERATION_NOT_SUPPORTED),

    // ==================== Cache Errors (5xx) ====================

    CACHE_CORRUPTED("PW-500", "Cache unreadable or incompatible", ErrorCategory.FATAL, ErrorKind.INTERNAL),
    CACHE_WRITE_FAILED("PW-501", "Cache could not be written", ErrorCategory.FATAL, ErrorKind.INTERNAL),

    // ==================== Internal Errors (9xx) ====================

    UNEXPECTED_ERROR("PW-901", "Unexpected error occurred", ErrorCategory.FATAL, ErrorKind.INTERNAL),
    CONFIGURATION_ERROR("PW-902", "Configuration error", ErrorCategory.FATAL, ErrorKind.INTERNAL);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    private final ErrorKind kind;

    ErrorCode(String code, String defaultMessage, ErrorCategory category, ErrorKind kind) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
        this.kind = kind;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * Per-host result classification for this code.
     */
    public ErrorKind getKind() {
        return kind;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - retry later or fix the request.
         */
        RECOVERABLE,

        /**
         * Fatal errors - operator intervention required.
         */
        FATAL
    }
}
