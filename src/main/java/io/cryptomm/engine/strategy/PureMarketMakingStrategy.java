package io.cryptomm.engine.strategy;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.exception.EngineException;
import io.cryptomm.engine.core.exception.InvalidConfigurationException;
import io.cryptomm.engine.core.inventory.InventoryManager;
import io.cryptomm.engine.core.inventory.InventoryRegistry;
import io.cryptomm.engine.core.model.Order;
import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderType;
import io.cryptomm.engine.core.model.Quote;
import io.cryptomm.engine.core.model.RebalanceAction;
import io.cryptomm.engine.core.orderbook.OrderBook;
import io.cryptomm.engine.core.orderbook.OrderBookManager;
import io.cryptomm.engine.core.order.OrderManager;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Symmetric quoting around the mid price, shifted by the inventory skew.
 * <p>
 * Each tick applies staged configuration, checks the rebalance signal and
 * requotes when the mid moved by more than {@code minRefreshBps}, when the
 * quotes aged past {@code orderTtlTicks}, or after a fill.
 */
@Slf4j
@Component
public class PureMarketMakingStrategy implements QuotingStrategy {
    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);
    private static final BigDecimal HALF_BPS = BigDecimal.valueOf(20_000);

    private final OrderBookManager orderBooks;
    private final OrderManager orderManager;
    private final InventoryRegistry inventories;
    private final boolean enabled;

    private final AtomicReference<StrategyParams> pendingParams = new AtomicReference<>();
    private volatile StrategyParams params;
    private volatile boolean requoteRequested;
    // Last filled quantity seen per working order
    private final Map<String, BigDecimal> seenFills = new ConcurrentHashMap<>();

    // Tick state, touched only by the scheduler thread
    private BigDecimal lastQuotedMid;
    private long tick;
    private long lastQuoteTick;

    @Getter
    private final AtomicLong quoteCycles = new AtomicLong();
    @Getter
    private final AtomicLong fills = new AtomicLong();
    @Getter
    private final AtomicLong rebalances = new AtomicLong();

    public PureMarketMakingStrategy(OrderBookManager orderBooks, OrderManager orderManager,
                                    InventoryRegistry inventories, EngineProperties properties) {
        this.orderBooks = orderBooks;
        this.orderManager = orderManager;
        this.inventories = inventories;

        EngineProperties.Strategy cfg = properties.getStrategy();
        this.enabled = cfg.isEnabled();
        StrategyParams initial = StrategyParams.builder()
                .symbol(cfg.getSymbol())
                .spreadBps(cfg.getSpreadBps())
                .orderQuantity(cfg.getOrderQuantity())
                .orderLevels(cfg.getOrderLevels())
                .levelSpreadBps(cfg.getLevelSpreadBps())
                .minRefreshBps(cfg.getMinRefreshBps())
                .orderTtlTicks(cfg.getOrderTtlTicks())
                .build();
        validateParams(initial);
        this.params = initial;
    }

    @PostConstruct
    public void register() {
        orderManager.addListener(this);
        log.info("Pure market making on {}: spread={}bps, levels={}, qty={}, enabled={}",
                params.getSymbol(), params.getSpreadBps(), params.getOrderLevels(), params.getOrderQuantity(), enabled);
    }

    @Scheduled(fixedDelayString = "${engine.strategy.tick-interval-ms:1000}")
    public void scheduledTick() {
        if (enabled) {
            onTick();
        }
    }

    @Override
    public void updateParams(StrategyParams newParams) {
        validateParams(newParams);
        pendingParams.set(newParams);
        log.info("Strategy params staged: {}", newParams);
    }

    @Override
    public void validateParams(StrategyParams p) {
        if (p.getSymbol() == null || p.getSymbol().isBlank()) {
            throw new InvalidConfigurationException("Strategy symbol is required");
        }
        if (p.getSpreadBps() <= 0) {
            throw new InvalidConfigurationException("spreadBps must be positive, got " + p.getSpreadBps());
        }
        if (p.getOrderLevels() <= 0) {
            throw new InvalidConfigurationException("orderLevels must be positive, got " + p.getOrderLevels());
        }
        if (p.getOrderQuantity() == null || p.getOrderQuantity().signum() <= 0) {
            throw new InvalidConfigurationException("orderQuantity must be positive, got " + p.getOrderQuantity());
        }
        if (p.getLevelSpreadBps() < 0 || p.getMinRefreshBps() < 0 || p.getOrderTtlTicks() <= 0) {
            throw new InvalidConfigurationException("levelSpreadBps and minRefreshBps must be non-negative, "
                    + "orderTtlTicks positive");
        }
    }

    @Override
    public StrategyParams getParams() {
        return params;
    }

    @Override
    public void onTick() {
        tick++;
        try {
            runCycle();
        } catch (EngineException e) {
            log.error("Quoting cycle {} failed: {}", tick, e.getMessage());
        }
    }

    @Override
    public void onOrderUpdate(Order order) {
        log.debug("Order {} is {}", order.getClientOrderId(), order.getStatus());
        if (!params.getSymbol().equals(order.getSymbol())) {
            return;
        }
        BigDecimal filled = order.getFilledQuantity();
        BigDecimal seen = order.isTerminal()
                ? seenFills.remove(order.getClientOrderId())
                : seenFills.put(order.getClientOrderId(), filled);
        if (filled.signum() > 0 && (seen == null || filled.compareTo(seen) > 0)) {
            requoteRequested = true;
        }
    }

    @Override
    public void onOrderFill(Order order) {
        if (!params.getSymbol().equals(order.getSymbol())) {
            return;
        }
        fills.incrementAndGet();
        requoteRequested = true;
        log.info("Fill on {} {}: {}/{} @ {}", order.getSide(), order.getClientOrderId(), order.getFilledQuantity(),
                order.getRequestedQuantity(), order.getAvgFillPrice());
    }

    private void runCycle() {
        StrategyParams staged = pendingParams.getAndSet(null);
        if (staged != null) {
            if (!staged.getSymbol().equals(params.getSymbol())) {
                orderManager.cancelAllOrders(params.getSymbol());
            }
            params = staged;
            lastQuotedMid = null;
            log.info("Strategy params applied: {}", staged);
        }
        StrategyParams p = params;
        InventoryManager inventory = inventories.getOrCreate(p.getSymbol());
        inventory.applyPendingConfig();

        Optional<BigDecimal> midPrice = orderBooks.get(p.getSymbol()).flatMap(OrderBook::getMidPrice);
        if (midPrice.isEmpty()) {
            log.debug("No mid price for {}, skipping tick {}", p.getSymbol(), tick);
            return;
        }
        BigDecimal mid = midPrice.get();

        RebalanceAction action = inventory.getRebalanceAction();
        switch (action.getActionType()) {
            case EMERGENCY_STOP -> {
                log.error("Inventory emergency on {} ({}), pulling all quotes", p.getSymbol(),
                        inventory.getCurrentInventory());
                orderManager.cancelAllOrders(p.getSymbol());
                lastQuotedMid = null;
                return;
            }
            case MARKET_ORDER -> {
                log.warn("Rebalancing {}: market {} {}", p.getSymbol(), action.getSide(), action.getQuantity());
                orderManager.cancelAllOrders(p.getSymbol());
                orderManager.submitOrder(action.getSide(), OrderType.MARKET, null, action.getQuantity(), p.getSymbol());
                inventory.recordRebalance();
                rebalances.incrementAndGet();
                lastQuotedMid = null;
                return;
            }
            case LIMIT_ORDER -> log.debug("Inventory on {} above rebalance threshold, relying on skew", p.getSymbol());
            default -> { }
        }

        if (!shouldRefresh(p, mid)) {
            return;
        }
        placeQuotes(p, inventory, mid);
    }

    private boolean shouldRefresh(StrategyParams p, BigDecimal mid) {
        if (lastQuotedMid == null || requoteRequested) {
            return true;
        }
        if (orderManager.getActiveOrders(p.getSymbol()).isEmpty()) {
            return true;
        }
        if (tick - lastQuoteTick >= p.getOrderTtlTicks()) {
            return true;
        }
        BigDecimal changeBps = mid.subtract(lastQuotedMid).abs()
                .multiply(BPS)
                .divide(lastQuotedMid, MathContext.DECIMAL64);
        return changeBps.compareTo(BigDecimal.valueOf(p.getMinRefreshBps())) > 0;
    }

    private void placeQuotes(StrategyParams p, InventoryManager inventory, BigDecimal mid) {
        requoteRequested = false;
        if (!orderManager.getActiveOrders(p.getSymbol()).isEmpty()) {
            orderManager.cancelAllOrders(p.getSymbol());
        }

        BigDecimal halfSpread = mid.multiply(BigDecimal.valueOf(p.getSpreadBps())).divide(HALF_BPS, MathContext.DECIMAL64);
        for (int level = 0; level < p.getOrderLevels(); level++) {
            BigDecimal levelOffset = mid.multiply(BigDecimal.valueOf((long) level * p.getLevelSpreadBps()))
                    .divide(BPS, MathContext.DECIMAL64);
            BigDecimal bid = mid.subtract(halfSpread).subtract(levelOffset);
            BigDecimal ask = mid.add(halfSpread).add(levelOffset);
            Quote quote = inventory.adjustQuotes(bid, ask, mid);

            orderManager.submitOrder(OrderSide.BUY, OrderType.LIMIT, quote.getBid(), p.getOrderQuantity(), p.getSymbol());
            orderManager.submitOrder(OrderSide.SELL, OrderType.LIMIT, quote.getAsk(), p.getOrderQuantity(), p.getSymbol());
        }
        lastQuotedMid = mid;
        lastQuoteTick = tick;
        quoteCycles.incrementAndGet();
        log.debug("Quoted {} levels on {} around {}", p.getOrderLevels(), p.getSymbol(), mid);
    }
}
