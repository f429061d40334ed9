package io.cryptomm.engine.core.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Locally tracked order. Instances are owned by the order store; everything
 * handed out of the store is a {@link #copy()}.
 */
@Data
@Builder(toBuilder = true)
public class Order {
    private static final int PRICE_SCALE = 12;

    private final String clientOrderId;
    private String exchangeOrderId;
    private final String symbol;
    private final OrderSide side;
    private final OrderType type;
    private final BigDecimal price;
    private final BigDecimal requestedQuantity;
    @Builder.Default
    private BigDecimal filledQuantity = BigDecimal.ZERO;
    private BigDecimal avgFillPrice;
    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;
    @Builder.Default
    private Instant createdAt = Instant.now();
    private Instant submittedAt;
    private Instant updatedAt;

    public BigDecimal getRemainingQuantity() {
        return requestedQuantity.subtract(filledQuantity).max(BigDecimal.ZERO);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isFullyFilled() {
        return filledQuantity.compareTo(requestedQuantity) >= 0;
    }

    /**
     * Accumulates a fill and recomputes the volume-weighted average price.
     * Status moves to PARTIALLY_FILLED or FILLED depending on the new total.
     */
    public void applyFill(BigDecimal fillQuantity, BigDecimal fillPrice, Instant timestamp) {
        BigDecimal oldFilled = filledQuantity;
        BigDecimal newFilled = oldFilled.add(fillQuantity);
        if (avgFillPrice == null || oldFilled.signum() == 0) {
            avgFillPrice = fillPrice;
        } else {
            BigDecimal notional = avgFillPrice.multiply(oldFilled).add(fillPrice.multiply(fillQuantity));
            avgFillPrice = notional.divide(newFilled, PRICE_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
        }
        filledQuantity = newFilled;
        status = isFullyFilled() ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        updatedAt = timestamp;
    }

    public Order copy() {
        return toBuilder().build();
    }
}
