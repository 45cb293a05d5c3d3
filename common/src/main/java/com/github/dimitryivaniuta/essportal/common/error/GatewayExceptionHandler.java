package com.github.dimitryivaniuta.essportal.common.error;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps gateway exceptions to {@link ApiError} responses with a stable status code.
 *
 * <p>Internal details (stack traces, downstream bodies) go to the log only.</p>
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ApiError> handleGateway(final GatewayException ex) {
        if (ex.getStatus() >= 500) {
            log.error("Gateway error kind={} status={} message={}", ex.getKind(), ex.getStatus(), ex.getMessage(), ex);
        } else {
            log.warn("Gateway error kind={} status={} message={}", ex.getKind(), ex.getStatus(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(ApiError.of(ex.getKind().name(), ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleValidation(final WebExchangeBindException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(fe -> fields.put(fe.getField(), fe.getDefaultMessage()));
        log.warn("Validation failed: {}", fields);
        ApiError body = ApiError.builder()
                .code(ErrorKind.VALIDATION.name())
                .message("Request validation failed")
                .timestamp(java.time.Instant.now())
                .details(fields)
                .build();
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> handleInput(final ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getReason());
        return ResponseEntity.badRequest()
                .body(ApiError.of(ErrorKind.VALIDATION.name(), ex.getReason() != null ? ex.getReason() : "Malformed request"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleStatus(final ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        String code = status != null ? status.name() : ErrorKind.INTERNAL.name();
        return ResponseEntity.status(ex.getStatusCode())
                .body(ApiError.of(code, ex.getReason() != null ? ex.getReason() : code));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(final Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of(ErrorKind.INTERNAL.name(), "An unexpected error occurred"));
    }
}
