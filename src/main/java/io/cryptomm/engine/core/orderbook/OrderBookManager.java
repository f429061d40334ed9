package io.cryptomm.engine.core.orderbook;

import io.cryptomm.engine.core.model.BookSide;
import io.cryptomm.engine.core.model.Level;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of per-symbol order books. The map itself is guarded by one lock;
 * each book guards its own levels.
 */
@Slf4j
@Service
public class OrderBookManager {
    private final Map<String, OrderBook> orderBooks = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public OrderBook getOrCreate(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }

        lock.readLock().lock();
        try {
            OrderBook existing = orderBooks.get(symbol);
            if (existing != null) {
                return existing;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            return orderBooks.computeIfAbsent(symbol, s -> {
                log.info("Created order book for {}", s);
                return new OrderBook(s);
            });
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<OrderBook> get(String symbol) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(orderBooks.get(symbol));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean remove(String symbol) {
        lock.writeLock().lock();
        try {
            OrderBook removed = orderBooks.remove(symbol);
            if (removed != null) {
                removed.clear();
                log.info("Removed order book for {}", symbol);
                return true;
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> getSymbols() {
        lock.readLock().lock();
        try {
            return List.copyOf(new TreeSet<>(orderBooks.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Feed entry point for a full snapshot; creates the book on first use.
     */
    public void applySnapshot(String symbol, Collection<Level> bids, Collection<Level> asks, Instant timestamp) {
        getOrCreate(symbol).applySnapshot(bids, asks, timestamp);
    }

    /**
     * Feed entry point for a single level change; creates the book on first use.
     */
    public void applyUpdate(String symbol, BookSide side, BigDecimal price, BigDecimal size, int numOrders, Instant timestamp) {
        getOrCreate(symbol).applyUpdate(side, price, size, numOrders, timestamp);
    }

    @PreDestroy
    public void clear() {
        lock.writeLock().lock();
        try {
            orderBooks.values().forEach(OrderBook::clear);
            int count = orderBooks.size();
            orderBooks.clear();
            log.info("Order book registry cleared ({} books)", count);
        } finally {
            lock.writeLock().unlock();
        }
    }
}
