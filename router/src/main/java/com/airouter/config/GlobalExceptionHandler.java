package com.airouter.config;

import com.airouter.model.GenerationModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<GenerationModels.ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + ", " + b)
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);

        return Mono.just(ResponseEntity.badRequest()
                .body(createErrorResponse("invalid_request_error", message, "validation_error")));
    }

    // Malformed JSON or an unknown strategy name
    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<GenerationModels.ErrorResponse>> handleInputException(ServerWebInputException ex) {
        Throwable cause = ex.getMostSpecificCause();
        String message = cause != null && cause.getMessage() != null ? cause.getMessage() : ex.getReason();

        log.warn("Unreadable request: {}", message);

        return Mono.just(ResponseEntity.badRequest()
                .body(createErrorResponse("invalid_request_error", message, "invalid_body")));
    }

    // Anything escaping the routing loop is a router defect; provider failures never get here
    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<GenerationModels.ErrorResponse>> handleRouterFailure(Exception ex) {
        log.error("Router failed outside the fallback loop", ex);

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createErrorResponse("router_error", "The router could not complete the request", "routing_failed")));
    }

    private GenerationModels.ErrorResponse createErrorResponse(String type, String message, String code) {
        return GenerationModels.ErrorResponse.builder()
                .error(GenerationModels.ErrorResponse.Error.builder()
                        .type(type)
                        .message(message)
                        .code(code)
                        .build())
                .build();
    }
}
