package io.cryptomm.engine.core.exception;

import lombok.Getter;

@Getter
public class OrderNotFoundException extends EngineException {
    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super("Order not found: " + orderId);
        this.orderId = orderId;
    }
}
