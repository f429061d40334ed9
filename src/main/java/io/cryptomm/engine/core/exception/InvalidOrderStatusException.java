package io.cryptomm.engine.core.exception;

import io.cryptomm.engine.core.model.OrderStatus;
import lombok.Getter;

@Getter
public class InvalidOrderStatusException extends EngineException {
    private final String orderId;
    private final OrderStatus status;

    public InvalidOrderStatusException(String orderId, OrderStatus status, String reason) {
        super("Order " + orderId + " in status " + status + ": " + reason);
        this.orderId = orderId;
        this.status = status;
    }
}
