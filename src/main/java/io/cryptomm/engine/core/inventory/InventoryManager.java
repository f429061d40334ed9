package io.cryptomm.engine.core.inventory;

import io.cryptomm.engine.core.model.InventoryStats;
import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.Quote;
import io.cryptomm.engine.core.model.RebalanceAction;
import io.cryptomm.engine.core.model.RebalanceActionType;
import io.cryptomm.engine.core.model.SkewTier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Net position of one instrument and the quote skew derived from it.
 * <p>
 * Positive inventory (long) pushes both quotes down to attract sellers of our
 * position; negative inventory pushes them up. Fills arrive from the order
 * manager's event path, quote reads from the strategy thread; all state access
 * is synchronized on the instance.
 */
@Slf4j
public class InventoryManager {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    @Getter
    private final String symbol;
    private final AtomicReference<InventoryConfig> pendingConfig = new AtomicReference<>();
    private InventoryConfig config;

    private BigDecimal currentInventory = BigDecimal.ZERO;
    private BigDecimal peakInventory = BigDecimal.ZERO;
    private BigDecimal totalBought = BigDecimal.ZERO;
    private BigDecimal totalSold = BigDecimal.ZERO;
    private long fillCount;
    private long rebalanceCount;

    public InventoryManager(String symbol, InventoryConfig config) {
        config.validate();
        this.symbol = symbol;
        this.config = config;
    }

    public synchronized InventoryConfig getConfig() {
        return config;
    }

    public synchronized BigDecimal getCurrentInventory() {
        return currentInventory;
    }

    /**
     * Signed inventory over max inventory, not clamped.
     */
    public synchronized double inventoryRatio() {
        return currentInventory.divide(config.getMaxInventory(), MathContext.DECIMAL64).doubleValue();
    }

    /**
     * Normalized skew. LINEAR and EXPONENTIAL stay within [-1, 1]; TIERED is
     * the clamped ratio times the tier multiplier and may exceed unit magnitude.
     */
    public synchronized double calculateSkew() {
        double n = Math.max(-1.0, Math.min(1.0, inventoryRatio()));
        return switch (config.getSkewMode()) {
            case LINEAR -> n;
            case EXPONENTIAL -> Math.signum(n) * n * n;
            case TIERED -> n * tierMultiplier(Math.abs(n));
        };
    }

    /**
     * Shifts both quotes by the same signed offset
     * {@code skew * skewFactor * unit}, where the unit depends on the configured basis.
     */
    public synchronized Quote adjustQuotes(BigDecimal bid, BigDecimal ask, BigDecimal mid) {
        if (config.getSkewFactor() == 0.0) {
            return new Quote(bid, ask);
        }
        double scaled = calculateSkew() * config.getSkewFactor();
        if (scaled == 0.0) {
            return new Quote(bid, ask);
        }

        BigDecimal offset = offsetUnit(bid, ask, mid).multiply(BigDecimal.valueOf(scaled));
        log.trace("{}: skew offset {} (inventory={})", symbol, offset, currentInventory);
        return new Quote(bid.subtract(offset), ask.subtract(offset));
    }

    public synchronized void updateInventory(OrderSide side, BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Fill quantity must be positive, got " + quantity);
        }
        if (side == OrderSide.BUY) {
            currentInventory = currentInventory.add(quantity);
            totalBought = totalBought.add(quantity);
        } else {
            currentInventory = currentInventory.subtract(quantity);
            totalSold = totalSold.add(quantity);
        }
        fillCount++;
        trackPeak();
        log.debug("{}: inventory {} after {} {}", symbol, currentInventory, side, quantity);
    }

    /**
     * Overwrites the position, e.g. after reading it back from the exchange.
     */
    public synchronized void setInventory(BigDecimal inventory) {
        log.info("{}: inventory set {} -> {}", symbol, currentInventory, inventory);
        currentInventory = inventory;
        trackPeak();
    }

    public synchronized boolean needsRebalance() {
        return absRatio() >= config.getRebalanceThreshold();
    }

    public synchronized boolean isEmergency() {
        return absRatio() >= config.getEmergencyThreshold();
    }

    public synchronized RebalanceAction getRebalanceAction() {
        double ratio = absRatio();
        if (ratio < config.getRebalanceThreshold()) {
            return RebalanceAction.none();
        }

        OrderSide side = currentInventory.signum() > 0 ? OrderSide.SELL : OrderSide.BUY;
        BigDecimal quantity = currentInventory.subtract(config.getTargetInventory()).abs();
        if (ratio >= config.getEmergencyThreshold()) {
            return new RebalanceAction(RebalanceActionType.EMERGENCY_STOP, side, quantity);
        }

        double midBand = (config.getRebalanceThreshold() + config.getEmergencyThreshold()) / 2.0;
        RebalanceActionType type = ratio >= midBand ? RebalanceActionType.MARKET_ORDER : RebalanceActionType.LIMIT_ORDER;
        return new RebalanceAction(type, side, quantity);
    }

    public synchronized void recordRebalance() {
        rebalanceCount++;
    }

    /**
     * Validates {@code newConfig} now and stages it; the swap happens on the
     * next {@link #applyPendingConfig()} call.
     */
    public void requestReconfigure(InventoryConfig newConfig) {
        newConfig.validate();
        InventoryConfig previous = pendingConfig.getAndSet(newConfig);
        if (previous != null) {
            log.info("{}: replaced a pending inventory config that was never applied", symbol);
        }
    }

    /**
     * Applies a staged config, if any. Called between quoting cycles.
     *
     * @return true if a new config took effect
     */
    public boolean applyPendingConfig() {
        InventoryConfig next = pendingConfig.getAndSet(null);
        if (next == null) {
            return false;
        }
        synchronized (this) {
            config = next;
        }
        log.info("{}: inventory config applied: mode={}, max={}, skewFactor={}",
                symbol, next.getSkewMode(), next.getMaxInventory(), next.getSkewFactor());
        return true;
    }

    public boolean hasPendingConfig() {
        return pendingConfig.get() != null;
    }

    public synchronized InventoryStats getStats() {
        return InventoryStats.builder()
                .symbol(symbol)
                .currentInventory(currentInventory)
                .ratio(inventoryRatio())
                .skew(calculateSkew())
                .peakInventory(peakInventory)
                .totalBought(totalBought)
                .totalSold(totalSold)
                .fillCount(fillCount)
                .rebalanceCount(rebalanceCount)
                .needsRebalance(needsRebalance())
                .emergency(isEmergency())
                .build();
    }

    public synchronized void reset() {
        currentInventory = BigDecimal.ZERO;
        peakInventory = BigDecimal.ZERO;
        totalBought = BigDecimal.ZERO;
        totalSold = BigDecimal.ZERO;
        fillCount = 0;
        rebalanceCount = 0;
    }

    private double absRatio() {
        return Math.abs(inventoryRatio());
    }

    private double tierMultiplier(double absRatio) {
        double multiplier = 1.0;
        List<SkewTier> tiers = config.effectiveTiers();
        for (SkewTier tier : tiers) {
            if (tier.getThreshold() > absRatio) {
                break;
            }
            multiplier = tier.getMultiplier();
        }
        return multiplier;
    }

    private BigDecimal offsetUnit(BigDecimal bid, BigDecimal ask, BigDecimal mid) {
        return switch (config.getOffsetBasis()) {
            case HALF_SPREAD -> ask.subtract(bid).divide(TWO, MathContext.DECIMAL64);
            case PRICE_UNIT -> config.getPriceUnit();
            case MID_PRICE -> mid;
        };
    }

    private void trackPeak() {
        BigDecimal abs = currentInventory.abs();
        if (abs.compareTo(peakInventory) > 0) {
            peakInventory = abs;
        }
    }
}
