package io.cryptomm.engine.exchange;

import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ExchangeOrderRequest {
    String clientOrderId;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal price;
    BigDecimal quantity;
}
