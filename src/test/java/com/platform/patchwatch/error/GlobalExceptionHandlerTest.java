package com.platform.patchwatch.error;

import com.platform.patchwatch.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler =
        new GlobalExceptionHandler(new MetricsRegistry(new SimpleMeterRegistry()));
    private final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/report");

    @Test
    void mapsErrorCodesToHttpStatus() {
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.HOST_NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.OPERATION_IN_PROGRESS))
            .isEqualTo(HttpStatus.CONFLICT);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.OPERATION_NOT_SUPPORTED))
            .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.AUTHENTICATION_FAILED))
            .isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.COMMAND_TIMEOUT))
            .isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(GlobalExceptionHandler.mapErrorCodeToStatus(ErrorCode.CACHE_WRITE_FAILED))
            .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void unknownHostBecomesNotFound() {
        ResponseEntity<ErrorResponse> response =
            handler.handlePatchWatchException(new HostNotFoundException("web-9"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getCode()).isEqualTo("PW-300");
        assertThat(response.getBody().getPath()).isEqualTo("/api/report");
        assertThat(response.getBody().getTraceId()).isNotBlank();
    }

    @Test
    void corruptCacheCarriesRemedialAction() {
        ResponseEntity<ErrorResponse> response = handler.handleCacheCorruption(
            new CacheCorruptionException(Path.of("/var/lib/patchwatch/cache.json"), "invalid JSON"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().isFatal()).isTrue();
        assertThat(response.getBody().getDetail()).isEqualTo(CacheCorruptionException.REMEDIAL_ACTION);
        assertThat(response.getBody().getMetadata()).containsEntry("cacheFile", "/var/lib/patchwatch/cache.json");
    }

    @Test
    void duplicateHostReportsField() {
        ResponseEntity<ErrorResponse> response =
            handler.handleValidation(ValidationException.duplicateHost("web-1"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getFieldErrors()).singleElement()
            .satisfies(fe -> assertThat(fe.getRejectedValue()).isEqualTo("web-1"));
    }
}
