package io.cryptomm.engine.core.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A single execution against one of our orders.
 */
@Value
@Builder
public class OrderFillEvent {
    String orderId;
    BigDecimal fillQuantity;
    BigDecimal fillPrice;
    // Cumulative filled quantity after this execution, when the venue reports it
    BigDecimal totalFilled;
    @Builder.Default
    Instant timestamp = Instant.now();
}
