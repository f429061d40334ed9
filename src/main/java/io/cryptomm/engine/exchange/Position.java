package io.cryptomm.engine.exchange;

import io.cryptomm.engine.core.model.OrderSide;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Position {
    String symbol;
    // BUY = long, SELL = short
    OrderSide side;
    // Always non-negative
    BigDecimal size;
    BigDecimal entryPrice;
    @Builder.Default
    BigDecimal unrealizedPnl = BigDecimal.ZERO;
}
