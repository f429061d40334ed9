package io.cryptomm.engine.core.exception;

/**
 * Transport, authentication or venue-side failure of an exchange call.
 */
public class ExchangeException extends EngineException {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
