package io.cryptomm.engine.web.dto;

import io.cryptomm.engine.core.model.Order;
import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderStatus;
import io.cryptomm.engine.core.model.OrderType;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
public class OrderDto {
    private String clientOrderId;
    private String exchangeOrderId;
    private String symbol;
    private OrderSide side;
    private OrderType type;
    private BigDecimal price;
    private BigDecimal quantity;
    private BigDecimal filledQuantity;
    private BigDecimal avgFillPrice;
    private OrderStatus status;
    private Instant createdAt;
    private Instant updatedAt;

    public static OrderDto from(Order order) {
        return OrderDto.builder()
                .clientOrderId(order.getClientOrderId())
                .exchangeOrderId(order.getExchangeOrderId())
                .symbol(order.getSymbol())
                .side(order.getSide())
                .type(order.getType())
                .price(order.getPrice())
                .quantity(order.getRequestedQuantity())
                .filledQuantity(order.getFilledQuantity())
                .avgFillPrice(order.getAvgFillPrice())
                .status(order.getStatus())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
