package io.cryptomm.engine.core.exception;

public class InvalidConfigurationException extends EngineException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
