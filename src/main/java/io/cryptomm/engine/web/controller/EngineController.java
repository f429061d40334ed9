package io.cryptomm.engine.web.controller;

import io.cryptomm.engine.core.event.OrderFillEvent;
import io.cryptomm.engine.core.exception.OrderNotFoundException;
import io.cryptomm.engine.core.exception.OrderValidationException;
import io.cryptomm.engine.core.inventory.InventoryConfig;
import io.cryptomm.engine.core.inventory.InventoryManager;
import io.cryptomm.engine.core.inventory.InventoryRegistry;
import io.cryptomm.engine.core.model.InventoryStats;
import io.cryptomm.engine.core.model.Level;
import io.cryptomm.engine.core.model.Order;
import io.cryptomm.engine.core.order.OrderHistoryPage;
import io.cryptomm.engine.core.order.OrderManager;
import io.cryptomm.engine.core.order.OrderManagerStats;
import io.cryptomm.engine.core.orderbook.OrderBook;
import io.cryptomm.engine.core.orderbook.OrderBookManager;
import io.cryptomm.engine.exchange.ExchangeClient;
import io.cryptomm.engine.exchange.SimulatedExchangeClient;
import io.cryptomm.engine.strategy.QuotingStrategy;
import io.cryptomm.engine.strategy.StrategyParams;
import io.cryptomm.engine.web.dto.CreateOrderRequest;
import io.cryptomm.engine.web.dto.InventoryConfigRequest;
import io.cryptomm.engine.web.dto.LevelDto;
import io.cryptomm.engine.web.dto.LevelUpdateRequest;
import io.cryptomm.engine.web.dto.OrderBookDto;
import io.cryptomm.engine.web.dto.OrderBookSnapshotRequest;
import io.cryptomm.engine.web.dto.OrderDto;
import io.cryptomm.engine.web.dto.SimulatedFillRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EngineController {

    private final OrderBookManager orderBookManager;
    private final OrderManager orderManager;
    private final InventoryRegistry inventoryRegistry;
    private final ExchangeClient exchangeClient;
    private final QuotingStrategy strategy;

    // Order book

    @GetMapping("/orderbook/{symbol}")
    public ResponseEntity<OrderBookDto> getOrderBook(@PathVariable String symbol,
                                                     @RequestParam(defaultValue = "20") int depth) {
        return orderBookManager.get(symbol)
                .map(book -> ResponseEntity.ok(toDto(book, depth)))
                .orElseGet(() -> {
                    log.debug("REST GetOrderBook: no book for {}", symbol);
                    return ResponseEntity.notFound().build();
                });
    }

    @PutMapping("/orderbook/{symbol}")
    public OrderBookDto replaceOrderBook(@PathVariable String symbol, @RequestBody OrderBookSnapshotRequest request) {
        List<Level> bids = toLevels(request.getBids());
        List<Level> asks = toLevels(request.getAsks());
        orderBookManager.applySnapshot(symbol, bids, asks, Instant.now());
        log.info("REST Snapshot {}: {} bids, {} asks", symbol, bids.size(), asks.size());
        return toDto(orderBookManager.getOrCreate(symbol), 20);
    }

    @PostMapping("/orderbook/{symbol}/levels")
    public OrderBookDto updateLevel(@PathVariable String symbol, @RequestBody LevelUpdateRequest request) {
        if (request.getSide() == null) {
            throw new IllegalArgumentException("Level side is required");
        }
        orderBookManager.applyUpdate(symbol, request.getSide(), request.getPrice(), request.getSize(),
                request.getNumOrders(), Instant.now());
        log.debug("REST LevelUpdate {}: {} {} x {}", symbol, request.getSide(), request.getPrice(), request.getSize());
        return toDto(orderBookManager.getOrCreate(symbol), 20);
    }

    // Orders

    @GetMapping("/orders")
    public List<OrderDto> getActiveOrders(@RequestParam(required = false) String symbol) {
        List<Order> orders = orderManager.getActiveOrders(symbol);
        log.debug("REST GetOrders: {} active", orders.size());
        return orders.stream().map(OrderDto::from).toList();
    }

    @GetMapping("/orders/history")
    public Map<String, Object> getOrderHistory(@RequestParam(required = false) String symbol,
                                               @RequestParam(defaultValue = "0") int page) {
        OrderHistoryPage history = orderManager.getOrderHistory(symbol, page);
        return Map.of(
                "orders", history.getOrders().stream().map(OrderDto::from).toList(),
                "page", history.getPage(),
                "pageSize", history.getPageSize(),
                "total", history.getTotal(),
                "hasMore", history.isHasMore());
    }

    @GetMapping("/orders/stats")
    public OrderManagerStats getOrderStats() {
        return orderManager.getStats();
    }

    @GetMapping("/orders/{id}")
    public OrderDto getOrder(@PathVariable String id) {
        return orderManager.getOrder(id).map(OrderDto::from).orElseThrow(() -> new OrderNotFoundException(id));
    }

    @PostMapping("/orders")
    public ResponseEntity<OrderDto> createOrder(@RequestBody CreateOrderRequest request) {
        log.info("REST CreateOrder: {} {} {} {} @ {}", request.getSymbol(), request.getType(), request.getSide(),
                request.getQuantity(), request.getPrice());
        Order order = orderManager.submitOrder(request.getSide(), request.getType(), request.getPrice(),
                request.getQuantity(), request.getSymbol());
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderDto.from(order));
    }

    @DeleteMapping("/orders/{id}")
    public OrderDto cancelOrder(@PathVariable String id) {
        log.info("REST CancelOrder: id={}", id);
        return OrderDto.from(orderManager.cancelOrder(id));
    }

    @DeleteMapping("/orders")
    public Map<String, Object> cancelAllOrders(@RequestParam(required = false) String symbol) {
        log.info("REST CancelAll: symbol={}", symbol);
        int cancelled = orderManager.cancelAllOrders(symbol);
        return Map.of("cancelled", cancelled);
    }

    @PostMapping("/orders/{id}/refresh")
    public OrderDto refreshOrder(@PathVariable String id) {
        return OrderDto.from(orderManager.refreshOrderStatus(id));
    }

    // Inventory

    @GetMapping("/inventory/{symbol}")
    public ResponseEntity<InventoryStats> getInventory(@PathVariable String symbol) {
        return inventoryRegistry.get(symbol)
                .map(manager -> ResponseEntity.ok(manager.getStats()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/inventory/{symbol}/config")
    public ResponseEntity<Map<String, Object>> reconfigureInventory(@PathVariable String symbol,
                                                                    @RequestBody InventoryConfigRequest request) {
        InventoryManager manager = inventoryRegistry.getOrCreate(symbol);
        InventoryConfig next = merge(manager.getConfig(), request);
        manager.requestReconfigure(next);
        log.info("REST Inventory config staged for {}", symbol);
        return ResponseEntity.accepted().body(Map.of("symbol", symbol, "pending", true));
    }

    @PostMapping("/inventory/sync")
    public List<InventoryStats> syncInventory() {
        int synced = inventoryRegistry.sync(exchangeClient.getPositions());
        log.info("REST InventorySync: {} positions from {}", synced, exchangeClient.getName());
        return inventoryRegistry.getSymbols().stream()
                .map(s -> inventoryRegistry.getOrCreate(s).getStats())
                .toList();
    }

    // Strategy

    @GetMapping("/strategy")
    public StrategyParams getStrategyParams() {
        return strategy.getParams();
    }

    @PutMapping("/strategy")
    public ResponseEntity<StrategyParams> updateStrategyParams(@RequestBody StrategyParams params) {
        strategy.updateParams(params);
        return ResponseEntity.accepted().body(params);
    }

    // Paper exchange

    @PostMapping("/simulator/orders/{exchangeOrderId}/fills")
    public ResponseEntity<OrderFillEvent> simulateFill(@PathVariable String exchangeOrderId,
                                                       @RequestBody SimulatedFillRequest request) {
        if (!(exchangeClient instanceof SimulatedExchangeClient simulator)) {
            throw new OrderValidationException("Fills can only be injected into the simulated exchange");
        }
        OrderFillEvent event = simulator.simulateFill(exchangeOrderId, request.getQuantity(), request.getPrice());
        return ResponseEntity.accepted().body(event);
    }

    private OrderBookDto toDto(OrderBook book, int depth) {
        return OrderBookDto.builder()
                .symbol(book.getSymbol())
                .depth(depth)
                .bids(book.getBids(depth).stream().map(LevelDto::from).toList())
                .asks(book.getAsks(depth).stream().map(LevelDto::from).toList())
                .midPrice(book.getMidPrice().orElse(null))
                .spread(book.getSpread().orElse(null))
                .sequence(book.getSequence())
                .lastUpdateTime(book.getLastUpdateTime())
                .build();
    }

    private static List<Level> toLevels(List<LevelDto> levels) {
        if (levels == null) {
            return List.of();
        }
        return levels.stream().map(LevelDto::toLevel).toList();
    }

    private static InventoryConfig merge(InventoryConfig current, InventoryConfigRequest request) {
        InventoryConfig.InventoryConfigBuilder builder = current.toBuilder();
        if (request.getMaxInventory() != null) {
            builder.maxInventory(request.getMaxInventory());
        }
        if (request.getTargetInventory() != null) {
            builder.targetInventory(request.getTargetInventory());
        }
        if (request.getSkewMode() != null) {
            builder.skewMode(request.getSkewMode());
        }
        if (request.getSkewFactor() != null) {
            builder.skewFactor(request.getSkewFactor());
        }
        if (request.getTiers() != null) {
            builder.clearTiers().tiers(request.getTiers());
        }
        if (request.getRebalanceThreshold() != null) {
            builder.rebalanceThreshold(request.getRebalanceThreshold());
        }
        if (request.getEmergencyThreshold() != null) {
            builder.emergencyThreshold(request.getEmergencyThreshold());
        }
        if (request.getOffsetBasis() != null) {
            builder.offsetBasis(request.getOffsetBasis());
        }
        if (request.getPriceUnit() != null) {
            builder.priceUnit(request.getPriceUnit());
        }
        return builder.build();
    }
}
