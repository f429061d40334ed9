package io.cryptomm.engine.core.exception;

import java.time.Duration;

public class ExchangeTimeoutException extends ExchangeException {

    public ExchangeTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + " ms");
    }
}
