package com.platform.patchwatch.error;

/**
 * Exception for validation errors in configuration and requests.
 */
public class ValidationException extends PatchWatchException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationException duplicateHost(String name) {
        return new ValidationException(ErrorCode.DUPLICATE_HOST, "name", name,
            "host names must be unique within the inventory");
    }

    /**
     * A configured host that cannot be used as given.
     */
    public static ValidationException invalidHost(String field, Object value, String message) {
        return new ValidationException(ErrorCode.CONFIGURATION_ERROR, field, value, message);
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
