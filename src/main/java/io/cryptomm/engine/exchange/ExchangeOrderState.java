package io.cryptomm.engine.exchange;

import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderStatus;
import io.cryptomm.engine.core.model.OrderType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
public class ExchangeOrderState {
    String exchangeOrderId;
    String clientOrderId;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal price;
    BigDecimal quantity;
    @Builder.Default
    BigDecimal filledQuantity = BigDecimal.ZERO;
    BigDecimal avgFillPrice;
    OrderStatus status;
}
