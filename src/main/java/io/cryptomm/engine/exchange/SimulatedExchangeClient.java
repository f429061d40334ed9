package io.cryptomm.engine.exchange;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.event.OrderFillEvent;
import io.cryptomm.engine.core.exception.ExchangeException;
import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderStatus;
import io.cryptomm.engine.core.model.OrderType;
import io.cryptomm.engine.core.model.SlippageResult;
import io.cryptomm.engine.core.orderbook.OrderBook;
import io.cryptomm.engine.core.orderbook.OrderBookManager;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory paper exchange. Limit orders rest until cancelled or filled through
 * {@link #simulateFill}; market orders execute immediately against the local
 * order book for the symbol. Fills on resting orders are published as
 * {@link OrderFillEvent}s, the same way a venue stream would deliver them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulatedExchangeClient implements ExchangeClient {

    private final EngineProperties properties;
    private final OrderBookManager orderBookManager;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, ExchangeOrderState> orders = new ConcurrentHashMap<>();
    private final Map<String, SimulatedPosition> positions = new ConcurrentHashMap<>();
    private final AtomicLong nextOrderId = new AtomicLong(1);

    @Getter(value = AccessLevel.PACKAGE, lazy = true)
    private final RequestSigner signer = new RequestSigner(
            properties.getExchange().getApiKey(), properties.getExchange().getApiSecret());

    @Override
    public String getName() {
        return properties.getExchange().getName();
    }

    @Override
    public ExchangeOrderAck submitOrder(ExchangeOrderRequest request) {
        String signature = getSigner().sign(request.getClientOrderId() + request.getSymbol() + request.getQuantity());
        log.debug("SIM: submit {} signed {}...", request.getClientOrderId(), signature.substring(0, 8));
        simulateLatency();

        String exchangeOrderId = "SIM-" + nextOrderId.getAndIncrement();
        ExchangeOrderState.ExchangeOrderStateBuilder state = ExchangeOrderState.builder()
                .exchangeOrderId(exchangeOrderId)
                .clientOrderId(request.getClientOrderId())
                .symbol(request.getSymbol())
                .side(request.getSide())
                .type(request.getType())
                .price(request.getPrice())
                .quantity(request.getQuantity());

        if (request.getType() == OrderType.LIMIT) {
            orders.put(exchangeOrderId, state.status(OrderStatus.SUBMITTED).build());
            log.info("SIM: {} resting {} {} @ {} as {}", request.getSymbol(), request.getSide(),
                    request.getQuantity(), request.getPrice(), exchangeOrderId);
            return ExchangeOrderAck.builder().exchangeOrderId(exchangeOrderId).build();
        }

        Optional<SlippageResult> execution = orderBookManager.get(request.getSymbol())
                .flatMap(book -> book.getSlippage(request.getSide().bookSide(), request.getQuantity()));
        if (execution.isEmpty()) {
            orders.put(exchangeOrderId, state.status(OrderStatus.REJECTED).build());
            log.warn("SIM: market order {} rejected, not enough liquidity on {}", exchangeOrderId, request.getSymbol());
            return ExchangeOrderAck.builder()
                    .exchangeOrderId(exchangeOrderId)
                    .status(OrderStatus.REJECTED)
                    .rejectReason("Insufficient liquidity")
                    .build();
        }

        BigDecimal avgPrice = execution.get().getAvgPrice();
        orders.put(exchangeOrderId, state.status(OrderStatus.FILLED)
                .filledQuantity(request.getQuantity())
                .avgFillPrice(avgPrice)
                .build());
        position(request.getSymbol()).update(signed(request.getSide(), request.getQuantity()), avgPrice);
        log.info("SIM: market {} {} {} filled @ {}", request.getSymbol(), request.getSide(), request.getQuantity(), avgPrice);
        return ExchangeOrderAck.builder()
                .exchangeOrderId(exchangeOrderId)
                .status(OrderStatus.FILLED)
                .filledQuantity(request.getQuantity())
                .avgFillPrice(avgPrice)
                .build();
    }

    @Override
    public void cancelOrder(String symbol, String exchangeOrderId) {
        getSigner().sign("cancel" + exchangeOrderId);
        simulateLatency();

        ExchangeOrderState state = orders.get(exchangeOrderId);
        if (state == null) {
            throw new ExchangeException("Unknown order " + exchangeOrderId);
        }
        if (state.getStatus().isTerminal()) {
            throw new ExchangeException("Order " + exchangeOrderId + " is already " + state.getStatus());
        }
        orders.put(exchangeOrderId, state.toBuilder().status(OrderStatus.CANCELLED).build());
        log.info("SIM: cancelled {}", exchangeOrderId);
    }

    @Override
    public int cancelAllOrders(String symbol) {
        getSigner().sign("cancelAll" + symbol);
        simulateLatency();

        int cancelled = 0;
        for (ExchangeOrderState state : openOrders(symbol)) {
            orders.put(state.getExchangeOrderId(), state.toBuilder().status(OrderStatus.CANCELLED).build());
            cancelled++;
        }
        log.info("SIM: cancelled {} open orders for {}", cancelled, symbol == null ? "all symbols" : symbol);
        return cancelled;
    }

    @Override
    public Optional<ExchangeOrderState> getOrder(String symbol, String exchangeOrderId) {
        simulateLatency();
        return Optional.ofNullable(orders.get(exchangeOrderId));
    }

    @Override
    public List<ExchangeOrderState> getOpenOrders(String symbol) {
        simulateLatency();
        return openOrders(symbol);
    }

    @Override
    public List<Balance> getBalance() {
        List<Balance> balances = new ArrayList<>();
        properties.getExchange().getBalances().forEach((asset, total) ->
                balances.add(new Balance(asset, total, total, BigDecimal.ZERO)));
        return balances;
    }

    @Override
    public List<Position> getPositions() {
        List<Position> result = new ArrayList<>();
        positions.forEach((symbol, position) -> {
            if (position.quantity.signum() != 0) {
                result.add(Position.builder()
                        .symbol(symbol)
                        .side(position.quantity.signum() > 0 ? OrderSide.BUY : OrderSide.SELL)
                        .size(position.quantity.abs())
                        .entryPrice(position.averagePrice)
                        .unrealizedPnl(unrealizedPnl(symbol, position))
                        .build());
            }
        });
        result.sort(Comparator.comparing(Position::getSymbol));
        return result;
    }

    /**
     * Executes part or all of a resting order and publishes the resulting fill event.
     */
    public OrderFillEvent simulateFill(String exchangeOrderId, BigDecimal quantity, BigDecimal price) {
        ExchangeOrderState state = orders.get(exchangeOrderId);
        if (state == null || state.getStatus().isTerminal()) {
            throw new ExchangeException("Order " + exchangeOrderId + " is not open");
        }
        BigDecimal remaining = state.getQuantity().subtract(state.getFilledQuantity());
        if (quantity.signum() <= 0 || quantity.compareTo(remaining) > 0) {
            throw new ExchangeException("Fill quantity " + quantity + " outside (0, " + remaining + "]");
        }

        BigDecimal filled = state.getFilledQuantity().add(quantity);
        BigDecimal avg = state.getAvgFillPrice() == null
                ? price
                : state.getAvgFillPrice().multiply(state.getFilledQuantity()).add(price.multiply(quantity))
                        .divide(filled, MathContext.DECIMAL64);
        OrderStatus status = filled.compareTo(state.getQuantity()) >= 0 ? OrderStatus.FILLED : OrderStatus.PARTIALLY_FILLED;
        orders.put(exchangeOrderId, state.toBuilder().filledQuantity(filled).avgFillPrice(avg).status(status).build());
        position(state.getSymbol()).update(signed(state.getSide(), quantity), price);

        OrderFillEvent event = OrderFillEvent.builder()
                .orderId(exchangeOrderId)
                .fillQuantity(quantity)
                .fillPrice(price)
                .totalFilled(filled)
                .timestamp(Instant.now())
                .build();
        log.info("SIM: fill {} {} @ {} (total {})", exchangeOrderId, quantity, price, filled);
        eventPublisher.publishEvent(event);
        return event;
    }

    private List<ExchangeOrderState> openOrders(String symbol) {
        return orders.values().stream()
                .filter(o -> !o.getStatus().isTerminal())
                .filter(o -> symbol == null || symbol.equals(o.getSymbol()))
                .sorted(Comparator.comparing(ExchangeOrderState::getExchangeOrderId))
                .toList();
    }

    private SimulatedPosition position(String symbol) {
        return positions.computeIfAbsent(symbol, s -> new SimulatedPosition());
    }

    private BigDecimal unrealizedPnl(String symbol, SimulatedPosition position) {
        return orderBookManager.get(symbol)
                .flatMap(OrderBook::getMidPrice)
                .map(mid -> mid.subtract(position.averagePrice).multiply(position.quantity))
                .orElse(BigDecimal.ZERO);
    }

    private static BigDecimal signed(OrderSide side, BigDecimal quantity) {
        return side == OrderSide.BUY ? quantity : quantity.negate();
    }

    private void simulateLatency() {
        Duration latency = properties.getExchange().getLatency();
        if (latency == null || latency.isZero()) {
            return;
        }
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException("Interrupted while waiting for the exchange", e);
        }
    }

    private static final class SimulatedPosition {
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal averagePrice = BigDecimal.ZERO;

        synchronized void update(BigDecimal quantityDelta, BigDecimal executionPrice) {
            BigDecimal newQuantity = quantity.add(quantityDelta);
            boolean crossingZero = quantity.signum() * newQuantity.signum() < 0;

            if (crossingZero) {
                averagePrice = executionPrice;
            } else if (newQuantity.signum() == 0) {
                averagePrice = BigDecimal.ZERO;
            } else if (quantity.signum() == 0 || quantity.signum() == quantityDelta.signum()) {
                // Adding to the position
                BigDecimal oldValue = averagePrice.multiply(quantity.abs());
                BigDecimal newValue = executionPrice.multiply(quantityDelta.abs());
                averagePrice = oldValue.add(newValue).divide(newQuantity.abs(), 9, RoundingMode.HALF_UP);
            }
            // Reducing keeps the average

            quantity = newQuantity;
        }
    }
}
