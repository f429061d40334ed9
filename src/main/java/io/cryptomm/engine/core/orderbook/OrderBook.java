package io.cryptomm.engine.core.orderbook;

import io.cryptomm.engine.core.model.BookSide;
import io.cryptomm.engine.core.model.Level;
import io.cryptomm.engine.core.model.SlippageResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * L2 order book for one symbol.
 * <p>
 * Bids are kept in descending price order and asks in ascending price order, so
 * the best price of either side is always at index 0. Writes (snapshot and
 * incremental updates from the feed) take the write lock, queries take the read lock.
 */
@Slf4j
public class OrderBook {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final MathContext DIVISION = new MathContext(20, RoundingMode.HALF_UP);

    @Getter
    private final String symbol;
    private final List<Level> bids = new ArrayList<>();
    private final List<Level> asks = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Instant lastUpdateTime;
    private long sequence;

    public OrderBook(String symbol) {
        this.symbol = symbol;
        this.lastUpdateTime = Instant.now();
    }

    /**
     * Replaces both sides. Zero-size entries are dropped and repeated prices
     * collapse onto the last entry seen.
     */
    public void applySnapshot(Collection<Level> newBids, Collection<Level> newAsks, Instant timestamp) {
        List<Level> sortedBids = normalize(newBids, Level.BY_PRICE_DESCENDING);
        List<Level> sortedAsks = normalize(newAsks, Level.BY_PRICE_ASCENDING);

        lock.writeLock().lock();
        try {
            bids.clear();
            bids.addAll(sortedBids);
            asks.clear();
            asks.addAll(sortedAsks);
            lastUpdateTime = timestamp;
            sequence = 0;
            log.debug("Snapshot applied to {}: bids={}, asks={}", symbol, bids.size(), asks.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies one incremental level change. A size of zero removes the level.
     */
    public void applyUpdate(BookSide side, BigDecimal price, BigDecimal size, int numOrders, Instant timestamp) {
        if (price == null || size == null) {
            throw new IllegalArgumentException("Price and size are required");
        }
        if (size.signum() < 0) {
            throw new IllegalArgumentException("Negative size " + size + " at " + price);
        }

        lock.writeLock().lock();
        try {
            List<Level> levels = levels(side);
            Comparator<Level> order = comparator(side);
            Level updated = Level.of(price, size, numOrders);
            int index = Collections.binarySearch(levels, updated, order);

            if (size.signum() == 0) {
                if (index >= 0) {
                    levels.remove(index);
                }
            } else if (index >= 0) {
                levels.set(index, updated);
            } else {
                levels.add(-index - 1, updated);
            }

            lastUpdateTime = timestamp;
            sequence++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Level> getBestBid() {
        lock.readLock().lock();
        try {
            return bids.isEmpty() ? Optional.empty() : Optional.of(bids.get(0));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Level> getBestAsk() {
        lock.readLock().lock();
        try {
            return asks.isEmpty() ? Optional.empty() : Optional.of(asks.get(0));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<BigDecimal> getMidPrice() {
        lock.readLock().lock();
        try {
            if (bids.isEmpty() || asks.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(bids.get(0).getPrice().add(asks.get(0).getPrice()).divide(TWO, DIVISION));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<BigDecimal> getSpread() {
        lock.readLock().lock();
        try {
            if (bids.isEmpty() || asks.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(asks.get(0).getPrice().subtract(bids.get(0).getPrice()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Total size resting at prices at least as good as {@code targetPrice}.
     * Relies on sort order: stops at the first level past the target.
     */
    public BigDecimal getDepth(BookSide side, BigDecimal targetPrice) {
        lock.readLock().lock();
        try {
            BigDecimal total = BigDecimal.ZERO;
            for (Level level : levels(side)) {
                int cmp = level.getPrice().compareTo(targetPrice);
                boolean included = side == BookSide.BID ? cmp >= 0 : cmp <= 0;
                if (!included) {
                    break;
                }
                total = total.add(level.getSize());
            }
            return total;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Cost of taking {@code quantity} from the book. {@code side} is the taker's
     * side: a BID (buy) walks the asks, an ASK (sell) walks the bids.
     *
     * @return empty when the opposing side cannot fill the whole quantity
     */
    public Optional<SlippageResult> getSlippage(BookSide side, BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }

        lock.readLock().lock();
        try {
            List<Level> levels = levels(side.opposite());
            if (levels.isEmpty()) {
                return Optional.empty();
            }

            BigDecimal bestPrice = levels.get(0).getPrice();
            BigDecimal remaining = quantity;
            BigDecimal totalCost = BigDecimal.ZERO;

            for (Level level : levels) {
                if (remaining.signum() == 0) {
                    break;
                }
                BigDecimal fillSize = remaining.min(level.getSize());
                totalCost = totalCost.add(fillSize.multiply(level.getPrice()));
                remaining = remaining.subtract(fillSize);
            }

            if (remaining.signum() > 0) {
                return Optional.empty();
            }

            BigDecimal avgPrice = totalCost.divide(quantity, DIVISION);
            BigDecimal slippagePct = avgPrice.subtract(bestPrice).abs().divide(bestPrice, DIVISION);
            return Optional.of(new SlippageResult(avgPrice, slippagePct, totalCost));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Level> getBids(int depth) {
        return copy(BookSide.BID, depth);
    }

    public List<Level> getAsks(int depth) {
        return copy(BookSide.ASK, depth);
    }

    public int getLevelCount(BookSide side) {
        lock.readLock().lock();
        try {
            return levels(side).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public long getSequence() {
        lock.readLock().lock();
        try {
            return sequence;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getLastUpdateTime() {
        lock.readLock().lock();
        try {
            return lastUpdateTime;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            bids.clear();
            asks.clear();
            sequence = 0;
            lastUpdateTime = Instant.now();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<Level> copy(BookSide side, int depth) {
        lock.readLock().lock();
        try {
            List<Level> levels = levels(side);
            return new ArrayList<>(levels.subList(0, Math.min(Math.max(depth, 0), levels.size())));
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Level> levels(BookSide side) {
        return side == BookSide.BID ? bids : asks;
    }

    private static Comparator<Level> comparator(BookSide side) {
        return side == BookSide.BID ? Level.BY_PRICE_DESCENDING : Level.BY_PRICE_ASCENDING;
    }

    private static List<Level> normalize(Collection<Level> levels, Comparator<Level> order) {
        TreeMap<Level, Level> unique = new TreeMap<>(order);
        if (levels != null) {
            for (Level level : levels) {
                if (level.getSize().signum() > 0) {
                    unique.put(level, level);
                } else {
                    unique.remove(level);
                }
            }
        }
        return new ArrayList<>(unique.values());
    }
}
