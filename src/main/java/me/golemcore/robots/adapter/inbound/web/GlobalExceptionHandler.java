package me.golemcore.robots.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.robots.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.robots.domain.model.RobotFailureKind;
import me.golemcore.robots.domain.model.RobotOperationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for robot controllers. Each
 * {@link RobotFailureKind} maps to exactly one status; the kind itself is echoed
 * in the {@code error} field.
 */
@ControllerAdvice(basePackages = "me.golemcore.robots.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RobotOperationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleRobotOperation(RobotOperationException ex) {
        HttpStatus status = statusOf(ex.getKind());
        log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(ex.getKind().name())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        String error = status.is4xxClientError() ? RobotFailureKind.INVALID_ARGUMENT.name() : status.name();
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(HttpStatus.INTERNAL_SERVER_ERROR.name())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    static HttpStatus statusOf(RobotFailureKind kind) {
        return switch (kind) {
        case NOT_FOUND -> HttpStatus.NOT_FOUND;
        case INVALID_ARGUMENT, NOT_HELD -> HttpStatus.BAD_REQUEST;
        case INSUFFICIENT_ENERGY, INCAPACITATED_ACTOR, CONFLICT -> HttpStatus.CONFLICT;
        };
    }
}
