package io.cryptomm.engine.exchange;

import io.cryptomm.engine.core.model.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Venue response to an accepted (or explicitly rejected) submission.
 */
@Value
@Builder
public class ExchangeOrderAck {
    String exchangeOrderId;
    @Builder.Default
    OrderStatus status = OrderStatus.SUBMITTED;
    @Builder.Default
    BigDecimal filledQuantity = BigDecimal.ZERO;
    BigDecimal avgFillPrice;
    String rejectReason;
}
