package com.platform.patchwatch.error;

import com.platform.patchwatch.observability.LoggingConfig;
import com.platform.patchwatch.observability.MetricsRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps exceptions from the REST layer onto {@link ErrorResponse}. Per-host
 * failures never get here; they are part of an operation report.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private final MetricsRegistry metricsRegistry;

    public GlobalExceptionHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @ExceptionHandler(CacheCorruptionException.class)
    public ResponseEntity<ErrorResponse> handleCacheCorruption(
            CacheCorruptionException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        log.error("[{}] Cache corrupted: {}", traceId, ex.getMessage());
        metricsRegistry.recordError(ex.getErrorCode().getCode());

        ErrorResponse response = base(ex.getErrorCode(), ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR,
            request, traceId)
            .detail(ex.getRemedialAction())
            .metadata(Map.of("cacheFile", String.valueOf(ex.getCacheFile())))
            .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        metricsRegistry.recordError(ex.getErrorCode().getCode());

        ErrorResponse.ErrorResponseBuilder builder = base(ex.getErrorCode(), ex.getMessage(),
            HttpStatus.BAD_REQUEST, request, traceId);
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(ErrorResponse.FieldError.builder()
                .field(ex.getField())
                .message(ex.getMessage())
                .rejectedValue(ex.getRejectedValue())
                .build()));
        }
        return ResponseEntity.badRequest().body(builder.build());
    }

    @ExceptionHandler(PatchWatchException.class)
    public ResponseEntity<ErrorResponse> handlePatchWatchException(
            PatchWatchException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL {}: {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {}: {}", traceId, errorCode.getCode(), ex.getMessage());
        }
        metricsRegistry.recordError(errorCode.getCode());

        return ResponseEntity.status(status).body(base(errorCode, ex.getMessage(), status, request, traceId).build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        String traceId = getOrCreateTraceId();
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        metricsRegistry.recordError(ErrorCode.VALIDATION_ERROR.getCode());

        ErrorResponse response = base(ErrorCode.VALIDATION_ERROR, "Validation failed", HttpStatus.BAD_REQUEST,
            request, traceId)
            .fieldErrors(fieldErrors)
            .build();
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception ex, HttpServletRequest request) {
        String traceId = getOrCreateTraceId();
        log.warn("[{}] Invalid request: {}", traceId, ex.getMessage());
        metricsRegistry.recordError(ErrorCode.INVALID_REQUEST.getCode());

        ErrorResponse response = base(ErrorCode.INVALID_REQUEST, ErrorCode.INVALID_REQUEST.getDefaultMessage(),
            HttpStatus.BAD_REQUEST, request, traceId)
            .detail(ex.getMessage())
            .build();
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        String traceId = getOrCreateTraceId();
        log.error("[{}] Unexpected error on {}", traceId, request.getRequestURI(), ex);
        metricsRegistry.recordError(ErrorCode.UNEXPECTED_ERROR.getCode());

        ErrorResponse response = base(ErrorCode.UNEXPECTED_ERROR, ErrorCode.UNEXPECTED_ERROR.getDefaultMessage(),
            HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
            .detail(ex.getClass().getSimpleName())
            .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case VALIDATION_ERROR, INVALID_REQUEST, DUPLICATE_HOST -> HttpStatus.BAD_REQUEST;
            case HOST_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case OPERATION_IN_PROGRESS -> HttpStatus.CONFLICT;
            case OPERATION_NOT_SUPPORTED, UNSUPPORTED_PLATFORM -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONNECTION_FAILED, CONNECTION_TIMEOUT, AUTHENTICATION_FAILED -> HttpStatus.BAD_GATEWAY;
            case COMMAND_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ErrorResponse.ErrorResponseBuilder base(ErrorCode code, String message, HttpStatus status,
                                                           HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(code.getCode())
            .message(message)
            .fatal(code.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }

    private static String getOrCreateTraceId() {
        String traceId = MDC.get(LoggingConfig.MDC_CORRELATION_ID);
        return traceId != null ? traceId : UUID.randomUUID().toString();
    }
}
