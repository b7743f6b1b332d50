package com.platform.patchwatch.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of every API error.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Error code, e.g. PW-300.
     */
    private String code;

    private String message;

    private String detail;

    /**
     * Whether the error needs operator intervention rather than a retry.
     */
    private boolean fatal;

    private int status;

    private Instant timestamp;

    private String path;

    /**
     * Correlation id of the request, for finding the matching log lines.
     */
    private String traceId;

    private List<FieldError> fieldErrors;

    private Map<String, Object> metadata;

    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
