package io.cryptomm.engine.core.exception;

public class OrderValidationException extends EngineException {

    public OrderValidationException(String message) {
        super(message);
    }
}
