package io.cryptomm.engine.core.event;

import io.cryptomm.engine.core.model.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Status snapshot for one order, as pushed by the exchange stream or produced by polling.
 * {@code orderId} is the exchange id when known, otherwise the client id.
 */
@Value
@Builder
public class OrderUpdateEvent {
    String orderId;
    OrderStatus status;
    // Cumulative
    BigDecimal filledQuantity;
    BigDecimal avgFillPrice;
    @Builder.Default
    Instant timestamp = Instant.now();
}
