package me.golemcore.meter.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.meter.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.meter.domain.model.ConfigUpdateException;
import me.golemcore.meter.domain.model.UnknownServiceException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for gateway controllers. Every error body has
 * the shape {@code {"error": "..."}}.
 */
@ControllerAdvice(basePackages = "me.golemcore.meter.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    private static final String NOT_FOUND = "Not found";

    @ExceptionHandler(UnknownServiceException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUnknownService(UnknownServiceException ex) {
        log.warn("[API] {}", ex.getMessage());
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiErrorResponse.of(ex.getMessage())));
    }

    @ExceptionHandler(ConfigUpdateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConfigUpdate(ConfigUpdateException ex) {
        HttpStatus status = ex.getReason() == ConfigUpdateException.Reason.PAYLOAD_TOO_LARGE
                ? HttpStatus.PAYLOAD_TOO_LARGE
                : HttpStatus.BAD_REQUEST;
        log.warn("[API] Config update rejected ({}): {}", status.value(), ex.getMessage());
        return Mono.just(ResponseEntity.status(status).body(ApiErrorResponse.of(ex.getMessage())));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        if (status == HttpStatus.NOT_FOUND || status == HttpStatus.METHOD_NOT_ALLOWED) {
            return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiErrorResponse.of(NOT_FOUND)));
        }
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        return Mono.just(ResponseEntity.status(status).body(ApiErrorResponse.of(message)));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiErrorResponse.of("Internal server error")));
    }
}
