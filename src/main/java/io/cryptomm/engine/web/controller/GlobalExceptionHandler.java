package io.cryptomm.engine.web.controller;

import io.cryptomm.engine.core.exception.EngineException;
import io.cryptomm.engine.core.exception.ExchangeException;
import io.cryptomm.engine.core.exception.ExchangeTimeoutException;
import io.cryptomm.engine.core.exception.InvalidConfigurationException;
import io.cryptomm.engine.core.exception.InvalidOrderStatusException;
import io.cryptomm.engine.core.exception.OrderNotFoundException;
import io.cryptomm.engine.core.exception.OrderValidationException;
import io.cryptomm.engine.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({OrderValidationException.class, InvalidConfigurationException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
        log.debug("REST rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(OrderNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(InvalidOrderStatusException.class)
    public ResponseEntity<ErrorResponse> handleConflict(InvalidOrderStatusException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(ExchangeTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(ExchangeTimeoutException e) {
        log.warn("Exchange timeout: {}", e.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, e);
    }

    @ExceptionHandler(ExchangeException.class)
    public ResponseEntity<ErrorResponse> handleExchange(ExchangeException e) {
        log.warn("Exchange error: {}", e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ErrorResponse> handleEngine(EngineException e) {
        log.error("Unhandled engine error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getClass().getSimpleName(), e.getMessage()));
    }
}
