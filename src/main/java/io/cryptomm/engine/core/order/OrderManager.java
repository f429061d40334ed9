package io.cryptomm.engine.core.order;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.event.OrderFillEvent;
import io.cryptomm.engine.core.event.OrderUpdateEvent;
import io.cryptomm.engine.core.exception.ExchangeException;
import io.cryptomm.engine.core.exception.ExchangeTimeoutException;
import io.cryptomm.engine.core.exception.InvalidOrderStatusException;
import io.cryptomm.engine.core.exception.OrderNotFoundException;
import io.cryptomm.engine.core.exception.OrderValidationException;
import io.cryptomm.engine.core.inventory.InventoryRegistry;
import io.cryptomm.engine.core.model.Order;
import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderStatus;
import io.cryptomm.engine.core.model.OrderType;
import io.cryptomm.engine.exchange.ExchangeClient;
import io.cryptomm.engine.exchange.ExchangeOrderAck;
import io.cryptomm.engine.exchange.ExchangeOrderRequest;
import io.cryptomm.engine.exchange.ExchangeOrderState;
import io.cryptomm.engine.strategy.StrategyListener;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Order lifecycle against the exchange.
 * <p>
 * {@code lock} guards store mutation, client id generation and the inventory
 * update for each event. Exchange calls run on {@code exchangeExecutor} with
 * a timeout and never while {@code lock} is held; listeners are notified after
 * it is released.
 */
@Slf4j
@Service
public class OrderManager {
    private final OrderStore store;
    private final ExchangeClient exchange;
    private final InventoryRegistry inventories;
    private final String clientIdPrefix;
    private final Duration defaultTimeout;

    private final ReentrantLock lock = new ReentrantLock();
    private final ExecutorService exchangeExecutor;
    private final List<StrategyListener> listeners = new CopyOnWriteArrayList<>();
    private long clientIdCounter;

    private long submittedCount;
    private long rejectedCount;
    private long cancelledCount;
    private long filledCount;
    private long ignoredEventCount;

    public OrderManager(OrderStore store, ExchangeClient exchange, InventoryRegistry inventories,
                        EngineProperties properties) {
        this.store = store;
        this.exchange = exchange;
        this.inventories = inventories;
        this.clientIdPrefix = properties.getOrders().getClientIdPrefix();
        this.defaultTimeout = properties.getOrders().getExchangeTimeout();

        AtomicInteger threadId = new AtomicInteger();
        this.exchangeExecutor = Executors.newFixedThreadPool(properties.getOrders().getExchangeThreads(), r -> {
            Thread t = new Thread(r, "exchange-" + threadId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(StrategyListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StrategyListener listener) {
        listeners.remove(listener);
    }

    public Order submitOrder(OrderSide side, OrderType type, BigDecimal price, BigDecimal quantity, String symbol) {
        return submitOrder(side, type, price, quantity, symbol, defaultTimeout);
    }

    /**
     * Validates, stores the order as PENDING and sends it to the exchange.
     * On exchange failure or timeout the order stays PENDING until
     * {@link #refreshOrderStatus(String)} resolves it.
     *
     * @throws OrderValidationException before any exchange call
     * @throws ExchangeException        if the exchange call fails or times out
     */
    public Order submitOrder(OrderSide side, OrderType type, BigDecimal price, BigDecimal quantity, String symbol,
                             Duration timeout) {
        validate(side, type, price, quantity, symbol);

        Order order;
        lock.lock();
        try {
            order = Order.builder()
                    .clientOrderId(nextClientOrderId())
                    .symbol(symbol)
                    .side(side)
                    .type(type)
                    .price(price)
                    .requestedQuantity(quantity)
                    .build();
            store.add(order);
            submittedCount++;
        } finally {
            lock.unlock();
        }
        log.info("Submitting {} {} {} {} @ {} as {}", symbol, type, side, quantity, price, order.getClientOrderId());

        ExchangeOrderRequest request = ExchangeOrderRequest.builder()
                .clientOrderId(order.getClientOrderId())
                .symbol(symbol)
                .side(side)
                .type(type)
                .price(price)
                .quantity(quantity)
                .build();
        ExchangeOrderAck ack;
        try {
            ack = callExchange("submitOrder " + order.getClientOrderId(), timeout, () -> exchange.submitOrder(request));
        } catch (ExchangeException e) {
            log.error("Order {} left PENDING: {}", order.getClientOrderId(), e.getMessage());
            throw e;
        }

        Order result;
        boolean becameFilled;
        lock.lock();
        try {
            Instant now = Instant.now();
            if (ack.getExchangeOrderId() != null) {
                store.assignExchangeId(order.getClientOrderId(), ack.getExchangeOrderId());
            }
            order.setSubmittedAt(now);
            if (ack.getStatus() == OrderStatus.REJECTED) {
                order.setStatus(OrderStatus.REJECTED);
                order.setUpdatedAt(now);
                rejectedCount++;
                log.warn("Order {} rejected by {}: {}", order.getClientOrderId(), exchange.getName(), ack.getRejectReason());
                becameFilled = false;
            } else {
                OrderStatus before = order.getStatus();
                OrderStatus status = before == OrderStatus.PENDING ? ack.getStatus() : null;
                becameFilled = reconcile(order, status, ack.getFilledQuantity(), ack.getAvgFillPrice(), now);
                countTransition(before, order.getStatus());
                log.info("Order {} acknowledged as {} ({})", order.getClientOrderId(), ack.getExchangeOrderId(),
                        order.getStatus());
            }
            store.reclassify(order);
            result = order.copy();
        } finally {
            lock.unlock();
        }
        notifyUpdate(result, becameFilled);
        return result;
    }

    /**
     * Cancels an active order. The local status changes only after the exchange confirms.
     */
    public Order cancelOrder(String orderId) {
        String symbol;
        String exchangeOrderId;
        lock.lock();
        try {
            Order order = requireCancellable(orderId);
            symbol = order.getSymbol();
            exchangeOrderId = order.getExchangeOrderId();
        } finally {
            lock.unlock();
        }

        callExchange("cancelOrder " + exchangeOrderId, defaultTimeout, () -> {
            exchange.cancelOrder(symbol, exchangeOrderId);
            return null;
        });

        Order result;
        lock.lock();
        try {
            Order order = store.liveByExchangeId(exchangeOrderId)
                    .orElseThrow(() -> new OrderNotFoundException(orderId));
            markCancelled(order);
            result = order.copy();
        } finally {
            lock.unlock();
        }
        log.info("Order {} cancelled", result.getClientOrderId());
        notifyUpdate(result, false);
        return result;
    }

    /**
     * Cancels every acknowledged active order, optionally for one symbol only.
     * Orders still waiting for an exchange id are left alone.
     *
     * @return number of local orders marked CANCELLED
     */
    public int cancelAllOrders(String symbol) {
        List<String> targets = new ArrayList<>();
        lock.lock();
        try {
            for (Order order : store.liveActiveOrders(symbol)) {
                if (order.getExchangeOrderId() != null) {
                    targets.add(order.getExchangeOrderId());
                } else {
                    log.debug("Skipping unacknowledged order {} in cancel-all", order.getClientOrderId());
                }
            }
        } finally {
            lock.unlock();
        }

        int confirmed = callExchange("cancelAllOrders " + symbol, defaultTimeout,
                () -> exchange.cancelAllOrders(symbol));

        List<Order> cancelled = new ArrayList<>();
        lock.lock();
        try {
            for (String exchangeOrderId : targets) {
                store.liveByExchangeId(exchangeOrderId)
                        .filter(o -> !o.isTerminal())
                        .ifPresent(o -> {
                            markCancelled(o);
                            cancelled.add(o.copy());
                        });
            }
        } finally {
            lock.unlock();
        }
        log.info("Cancel-all for {}: exchange confirmed {}, {} local orders cancelled",
                symbol == null ? "all symbols" : symbol, confirmed, cancelled.size());
        cancelled.forEach(o -> notifyUpdate(o, false));
        return cancelled.size();
    }

    /**
     * Reads the order back from the exchange and reconciles status, fills and inventory.
     */
    public Order refreshOrderStatus(String orderId) {
        String symbol;
        String clientOrderId;
        String exchangeOrderId;
        lock.lock();
        try {
            Order order = store.findLive(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
            symbol = order.getSymbol();
            clientOrderId = order.getClientOrderId();
            exchangeOrderId = order.getExchangeOrderId();
        } finally {
            lock.unlock();
        }

        Optional<ExchangeOrderState> remote;
        if (exchangeOrderId != null) {
            remote = callExchange("getOrder " + exchangeOrderId, defaultTimeout,
                    () -> exchange.getOrder(symbol, exchangeOrderId));
        } else {
            remote = callExchange("getOpenOrders " + symbol, defaultTimeout, () -> exchange.getOpenOrders(symbol))
                    .stream()
                    .filter(s -> clientOrderId.equals(s.getClientOrderId()))
                    .findFirst();
        }

        Order result;
        boolean becameFilled = false;
        lock.lock();
        try {
            Order order = store.liveByClientId(clientOrderId).orElseThrow(() -> new OrderNotFoundException(orderId));
            if (remote.isPresent()) {
                ExchangeOrderState state = remote.get();
                if (order.getExchangeOrderId() == null && state.getExchangeOrderId() != null) {
                    store.assignExchangeId(clientOrderId, state.getExchangeOrderId());
                    order.setSubmittedAt(Instant.now());
                }
                OrderStatus before = order.getStatus();
                becameFilled = reconcile(order, state.getStatus(), state.getFilledQuantity(),
                        state.getAvgFillPrice(), Instant.now());
                countTransition(before, order.getStatus());
                store.reclassify(order);
                log.info("Order {} refreshed: {} -> {}", clientOrderId, before, order.getStatus());
            } else {
                log.warn("Order {} not found on {}", clientOrderId, exchange.getName());
            }
            result = order.copy();
        } finally {
            lock.unlock();
        }
        if (remote.isPresent()) {
            notifyUpdate(result, becameFilled);
        }
        return result;
    }

    /**
     * Applies a pushed status snapshot. Unknown order ids are logged and ignored.
     */
    public void handleOrderUpdate(OrderUpdateEvent event) {
        Order result;
        boolean becameFilled;
        lock.lock();
        try {
            Optional<Order> found = store.findLive(event.getOrderId());
            if (found.isEmpty()) {
                ignoredEventCount++;
                log.warn("Ignoring update for unknown order {}", event.getOrderId());
                return;
            }
            Order order = found.get();
            OrderStatus before = order.getStatus();
            becameFilled = reconcile(order, event.getStatus(), event.getFilledQuantity(), event.getAvgFillPrice(),
                    event.getTimestamp());
            countTransition(before, order.getStatus());
            store.reclassify(order);
            result = order.copy();
            log.debug("Order {} update: {} -> {}, filled {}", order.getClientOrderId(), before, order.getStatus(),
                    order.getFilledQuantity());
        } finally {
            lock.unlock();
        }
        notifyUpdate(result, becameFilled);
    }

    /**
     * Applies one execution. When the event carries the cumulative filled
     * quantity, fills already accounted for are not counted again.
     */
    public void handleOrderFill(OrderFillEvent event) {
        Order result;
        boolean becameFilled;
        lock.lock();
        try {
            Optional<Order> found = store.findLive(event.getOrderId());
            if (found.isEmpty()) {
                ignoredEventCount++;
                log.warn("Ignoring fill for unknown order {}", event.getOrderId());
                return;
            }
            Order order = found.get();

            BigDecimal quantity = event.getFillQuantity();
            if (event.getTotalFilled() != null) {
                quantity = event.getTotalFilled().subtract(order.getFilledQuantity());
                if (quantity.signum() <= 0) {
                    log.debug("Fill for {} already applied (total {})", order.getClientOrderId(), event.getTotalFilled());
                    return;
                }
            }
            if (quantity == null || quantity.signum() <= 0) {
                ignoredEventCount++;
                log.warn("Ignoring fill with non-positive quantity for {}", order.getClientOrderId());
                return;
            }
            if (quantity.compareTo(order.getRemainingQuantity()) > 0) {
                log.warn("Fill of {} exceeds remaining {} on {}, clamping", quantity, order.getRemainingQuantity(),
                        order.getClientOrderId());
                quantity = order.getRemainingQuantity();
                if (quantity.signum() == 0) {
                    return;
                }
            }

            OrderStatus before = order.getStatus();
            order.applyFill(quantity, event.getFillPrice(), event.getTimestamp());
            if (before.isTerminal() && before != OrderStatus.FILLED) {
                // A late fill on a cancelled order does not reopen it
                order.setStatus(before);
            }
            inventories.getOrCreate(order.getSymbol()).updateInventory(order.getSide(), quantity);
            countTransition(before, order.getStatus());
            store.reclassify(order);
            becameFilled = before != OrderStatus.FILLED && order.getStatus() == OrderStatus.FILLED;
            result = order.copy();
            log.info("Fill {} {} @ {} on {} (filled {}/{}, avg {})", order.getSide(), quantity, event.getFillPrice(),
                    order.getClientOrderId(), order.getFilledQuantity(), order.getRequestedQuantity(),
                    order.getAvgFillPrice());
        } finally {
            lock.unlock();
        }
        notifyUpdate(result, becameFilled);
    }

    public Optional<Order> getOrder(String orderId) {
        lock.lock();
        try {
            return store.find(orderId);
        } finally {
            lock.unlock();
        }
    }

    public List<Order> getActiveOrders(String symbol) {
        lock.lock();
        try {
            return store.getActiveOrders(symbol);
        } finally {
            lock.unlock();
        }
    }

    public OrderHistoryPage getOrderHistory(String symbol, int page) {
        lock.lock();
        try {
            return store.getOrderHistory(symbol, page);
        } finally {
            lock.unlock();
        }
    }

    public OrderManagerStats getStats() {
        lock.lock();
        try {
            return OrderManagerStats.builder()
                    .activeOrders(store.getActiveCount())
                    .historicalOrders(store.getHistoryCount())
                    .submitted(submittedCount)
                    .rejected(rejectedCount)
                    .cancelled(cancelledCount)
                    .filled(filledCount)
                    .ignoredEvents(ignoredEventCount)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down exchange executor");
        exchangeExecutor.shutdownNow();
    }

    private void validate(OrderSide side, OrderType type, BigDecimal price, BigDecimal quantity, String symbol) {
        if (side == null || type == null) {
            throw new OrderValidationException("Order side and type are required");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new OrderValidationException("Symbol is required");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new OrderValidationException("Quantity must be positive, got " + quantity);
        }
        if (type == OrderType.LIMIT && (price == null || price.signum() <= 0)) {
            throw new OrderValidationException("Limit orders need a positive price, got " + price);
        }
    }

    // Caller holds lock
    private String nextClientOrderId() {
        return clientIdPrefix + "-" + System.currentTimeMillis() + "-" + (++clientIdCounter);
    }

    // Caller holds lock
    private Order requireCancellable(String orderId) {
        Order order = store.findLive(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
        if (order.isTerminal()) {
            throw new InvalidOrderStatusException(orderId, order.getStatus(), "order is no longer active");
        }
        if (order.getExchangeOrderId() == null) {
            throw new InvalidOrderStatusException(orderId, order.getStatus(), "order has no exchange id yet");
        }
        return order;
    }

    // Caller holds lock
    private void markCancelled(Order order) {
        if (order.isTerminal()) {
            return;
        }
        order.setStatus(OrderStatus.CANCELLED);
        order.setUpdatedAt(Instant.now());
        cancelledCount++;
        store.reclassify(order);
    }

    /**
     * Brings the order to a cumulative filled quantity and status. Increases of
     * the filled quantity feed the inventory; terminal statuses are final.
     * Caller holds lock.
     *
     * @return true if the order moved into FILLED
     */
    private boolean reconcile(Order order, OrderStatus status, BigDecimal cumulativeFilled, BigDecimal avgPrice,
                              Instant timestamp) {
        OrderStatus before = order.getStatus();
        if (cumulativeFilled != null && cumulativeFilled.compareTo(order.getFilledQuantity()) > 0) {
            BigDecimal delta = cumulativeFilled.subtract(order.getFilledQuantity());
            order.setFilledQuantity(cumulativeFilled);
            inventories.getOrCreate(order.getSymbol()).updateInventory(order.getSide(), delta);
        }
        if (avgPrice != null) {
            order.setAvgFillPrice(avgPrice);
        }
        if (!before.isTerminal()) {
            if (order.isFullyFilled()) {
                order.setStatus(OrderStatus.FILLED);
            } else if (status == OrderStatus.SUBMITTED && order.getFilledQuantity().signum() > 0) {
                order.setStatus(OrderStatus.PARTIALLY_FILLED);
            } else if (status != null && status != OrderStatus.PENDING) {
                order.setStatus(status);
            }
        }
        order.setUpdatedAt(timestamp);
        return before != OrderStatus.FILLED && order.getStatus() == OrderStatus.FILLED;
    }

    // Caller holds lock
    private void countTransition(OrderStatus before, OrderStatus after) {
        if (before == after) {
            return;
        }
        switch (after) {
            case FILLED -> filledCount++;
            case CANCELLED -> cancelledCount++;
            case REJECTED -> rejectedCount++;
            default -> { }
        }
    }

    private void notifyUpdate(Order order, boolean becameFilled) {
        for (StrategyListener listener : listeners) {
            try {
                listener.onOrderUpdate(order);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on update of {}", listener, order.getClientOrderId(), e);
            }
            if (becameFilled) {
                try {
                    listener.onOrderFill(order);
                } catch (RuntimeException e) {
                    log.error("Listener {} failed on fill of {}", listener, order.getClientOrderId(), e);
                }
            }
        }
    }

    private <T> T callExchange(String operation, Duration timeout, Callable<T> call) {
        Future<T> future = exchangeExecutor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("{} on {} timed out after {} ms", operation, exchange.getName(), timeout.toMillis());
            throw new ExchangeTimeoutException(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExchangeException exchangeException) {
                throw exchangeException;
            }
            throw new ExchangeException(operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ExchangeException(operation + " interrupted", e);
        }
    }
}
