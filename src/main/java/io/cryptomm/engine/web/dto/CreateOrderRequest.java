package io.cryptomm.engine.web.dto;

import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {
    private String symbol;
    private OrderSide side;
    private OrderType type;
    private BigDecimal price; // Ignored for MARKET
    private BigDecimal quantity;
}
