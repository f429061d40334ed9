package io.cryptomm.engine.core.order;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.model.Order;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Orders indexed by client id and exchange id, split into active and historical.
 * <p>
 * The store owns the {@link Order} instances. Public queries return copies;
 * the package-private {@code live} accessors are for {@link OrderManager}, which
 * mutates orders under its own lock and then calls {@link #reclassify(Order)}.
 */
@Slf4j
@Component
public class OrderStore {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, Order> byClientId = new HashMap<>();
    private final Map<String, String> clientIdByExchangeId = new HashMap<>();
    private final Map<String, Order> active = new LinkedHashMap<>();
    // Oldest first; newest at the tail
    private final Map<String, Deque<Order>> historyBySymbol = new HashMap<>();
    private final Map<String, Long> historySequence = new HashMap<>();
    private long nextHistorySequence;

    private final int pageSize;
    private final int maxHistoryPerSymbol;

    public OrderStore(EngineProperties properties) {
        this.pageSize = properties.getOrders().getHistoryPageSize();
        this.maxHistoryPerSymbol = properties.getOrders().getMaxHistoryPerSymbol();
    }

    /**
     * Registers a new order. Terminal orders go straight to history.
     */
    public void add(Order order) {
        lock.writeLock().lock();
        try {
            if (byClientId.containsKey(order.getClientOrderId())) {
                throw new IllegalArgumentException("Duplicate client order id " + order.getClientOrderId());
            }
            byClientId.put(order.getClientOrderId(), order);
            if (order.getExchangeOrderId() != null) {
                clientIdByExchangeId.put(order.getExchangeOrderId(), order.getClientOrderId());
            }
            if (order.isTerminal()) {
                appendHistory(order);
            } else {
                active.put(order.getClientOrderId(), order);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void assignExchangeId(String clientOrderId, String exchangeOrderId) {
        lock.writeLock().lock();
        try {
            Order order = byClientId.get(clientOrderId);
            if (order == null) {
                throw new IllegalArgumentException("Unknown client order id " + clientOrderId);
            }
            order.setExchangeOrderId(exchangeOrderId);
            clientIdByExchangeId.put(exchangeOrderId, clientOrderId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves the order to history if it has reached a terminal status.
     *
     * @return true if the order moved
     */
    public boolean reclassify(Order order) {
        lock.writeLock().lock();
        try {
            if (!order.isTerminal() || active.remove(order.getClientOrderId()) == null) {
                return false;
            }
            appendHistory(order);
            log.debug("Order {} moved to history as {}", order.getClientOrderId(), order.getStatus());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Order> getByClientId(String clientOrderId) {
        return liveByClientId(clientOrderId).map(Order::copy);
    }

    public Optional<Order> getByExchangeId(String exchangeOrderId) {
        return liveByExchangeId(exchangeOrderId).map(Order::copy);
    }

    /**
     * Looks the id up as an exchange id first, then as a client id.
     */
    public Optional<Order> find(String orderId) {
        return findLive(orderId).map(Order::copy);
    }

    public List<Order> getActiveOrders() {
        return getActiveOrders(null);
    }

    public List<Order> getActiveOrders(String symbol) {
        lock.readLock().lock();
        try {
            return active.values().stream()
                    .filter(o -> symbol == null || symbol.equals(o.getSymbol()))
                    .map(Order::copy)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public OrderHistoryPage getOrderHistory(String symbol, int page) {
        if (page < 0) {
            throw new IllegalArgumentException("Page must be non-negative, got " + page);
        }
        lock.readLock().lock();
        try {
            List<Order> all = new ArrayList<>();
            if (symbol != null) {
                all.addAll(historyBySymbol.getOrDefault(symbol, new ArrayDeque<>()));
            } else {
                historyBySymbol.values().forEach(all::addAll);
            }
            all.sort(Comparator.comparing((Order o) -> historySequence.get(o.getClientOrderId())).reversed());

            int from = Math.min(page * pageSize, all.size());
            int to = Math.min(from + pageSize, all.size());
            List<Order> orders = all.subList(from, to).stream().map(Order::copy).toList();
            return new OrderHistoryPage(orders, page, pageSize, all.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getActiveCount() {
        lock.readLock().lock();
        try {
            return active.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getHistoryCount() {
        lock.readLock().lock();
        try {
            return historySequence.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    Optional<Order> findLive(String orderId) {
        Optional<Order> byExchange = liveByExchangeId(orderId);
        return byExchange.isPresent() ? byExchange : liveByClientId(orderId);
    }

    Optional<Order> liveByClientId(String clientOrderId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byClientId.get(clientOrderId));
        } finally {
            lock.readLock().unlock();
        }
    }

    Optional<Order> liveByExchangeId(String exchangeOrderId) {
        lock.readLock().lock();
        try {
            String clientId = clientIdByExchangeId.get(exchangeOrderId);
            return clientId == null ? Optional.empty() : Optional.ofNullable(byClientId.get(clientId));
        } finally {
            lock.readLock().unlock();
        }
    }

    List<Order> liveActiveOrders(String symbol) {
        lock.readLock().lock();
        try {
            return active.values().stream()
                    .filter(o -> symbol == null || symbol.equals(o.getSymbol()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock
    private void appendHistory(Order order) {
        Deque<Order> history = historyBySymbol.computeIfAbsent(order.getSymbol(), s -> new ArrayDeque<>());
        history.addLast(order);
        historySequence.put(order.getClientOrderId(), nextHistorySequence++);

        while (history.size() > maxHistoryPerSymbol) {
            evict(history.pollFirst());
        }
    }

    private void evict(Order order) {
        byClientId.remove(order.getClientOrderId());
        historySequence.remove(order.getClientOrderId());
        if (order.getExchangeOrderId() != null) {
            clientIdByExchangeId.remove(order.getExchangeOrderId());
        }
        log.debug("Evicted {} from {} history", order.getClientOrderId(), order.getSymbol());
    }

    /**
     * Drops all orders. Intended for tests and engine resets.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            byClientId.clear();
            clientIdByExchangeId.clear();
            active.clear();
            historyBySymbol.clear();
            historySequence.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
