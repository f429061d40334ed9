package io.cryptomm.engine.core.order;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.model.Order;
import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderStatus;
import io.cryptomm.engine.core.model.OrderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderStoreTest {

    private OrderStore store;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getOrders().setHistoryPageSize(2);
        properties.getOrders().setMaxHistoryPerSymbol(3);
        store = new OrderStore(properties);
    }

    private static Order order(String clientId, String symbol) {
        return Order.builder()
                .clientOrderId(clientId)
                .symbol(symbol)
                .side(OrderSide.BUY)
                .type(OrderType.LIMIT)
                .price(new BigDecimal("100"))
                .requestedQuantity(BigDecimal.ONE)
                .build();
    }

    private void addAndClose(String clientId, String symbol, OrderStatus status) {
        Order o = order(clientId, symbol);
        store.add(o);
        o.setStatus(status);
        store.reclassify(o);
    }

    @Test
    void testAddAndFind() {
        store.add(order("c1", "BTC-USDT"));

        assertTrue(store.getByClientId("c1").isPresent());
        assertTrue(store.find("c1").isPresent());
        assertEquals(1, store.getActiveCount());
    }

    @Test
    void testDuplicateOrder() {
        store.add(order("c1", "BTC-USDT"));

        assertThrows(IllegalArgumentException.class, () -> store.add(order("c1", "BTC-USDT")));
    }

    @Test
    void testAssignExchangeId() {
        store.add(order("c1", "BTC-USDT"));
        assertTrue(store.getByExchangeId("X-1").isEmpty());

        store.assignExchangeId("c1", "X-1");

        assertEquals("c1", store.getByExchangeId("X-1").orElseThrow().getClientOrderId());
        assertEquals("c1", store.find("X-1").orElseThrow().getClientOrderId());
    }

    @Test
    void testQueriesReturnCopies() {
        Order live = order("c1", "BTC-USDT");
        store.add(live);

        Order copy = store.getByClientId("c1").orElseThrow();
        copy.setStatus(OrderStatus.CANCELLED);

        assertNotSame(live, copy);
        assertEquals(OrderStatus.PENDING, store.getByClientId("c1").orElseThrow().getStatus());
    }

    @Test
    void testTerminalOrderMovesToHistory() {
        Order o = order("c1", "BTC-USDT");
        store.add(o);
        store.assignExchangeId("c1", "X-1");

        o.setStatus(OrderStatus.FILLED);
        boolean moved = store.reclassify(o);

        assertTrue(moved);
        assertEquals(0, store.getActiveCount());
        assertEquals(1, store.getHistoryCount());
        assertTrue(store.getByClientId("c1").isPresent());
        assertTrue(store.getByExchangeId("X-1").isPresent());
        assertFalse(store.reclassify(o));
    }

    @Test
    void testActiveOrderStaysActive() {
        Order o = order("c1", "BTC-USDT");
        store.add(o);
        o.setStatus(OrderStatus.PARTIALLY_FILLED);

        assertFalse(store.reclassify(o));
        assertEquals(1, store.getActiveCount());
    }

    @Test
    void testActiveOrdersBySymbol() {
        store.add(order("c1", "BTC-USDT"));
        store.add(order("c2", "ETH-USDT"));

        assertEquals(2, store.getActiveOrders().size());
        assertEquals(List.of("c2"), store.getActiveOrders("ETH-USDT").stream().map(Order::getClientOrderId).toList());
    }

    @Test
    void testHistoryPaging() {
        addAndClose("c1", "BTC-USDT", OrderStatus.FILLED);
        addAndClose("c2", "ETH-USDT", OrderStatus.CANCELLED);
        addAndClose("c3", "BTC-USDT", OrderStatus.REJECTED);

        OrderHistoryPage first = store.getOrderHistory(null, 0);
        OrderHistoryPage second = store.getOrderHistory(null, 1);

        assertEquals(List.of("c3", "c2"), first.getOrders().stream().map(Order::getClientOrderId).toList());
        assertTrue(first.isHasMore());
        assertEquals(List.of("c1"), second.getOrders().stream().map(Order::getClientOrderId).toList());
        assertFalse(second.isHasMore());
        assertEquals(3, first.getTotal());

        OrderHistoryPage btc = store.getOrderHistory("BTC-USDT", 0);
        assertEquals(List.of("c3", "c1"), btc.getOrders().stream().map(Order::getClientOrderId).toList());
    }

    @Test
    void testHistoryRetention() {
        Order first = order("c1", "BTC-USDT");
        store.add(first);
        store.assignExchangeId("c1", "X-1");
        first.setStatus(OrderStatus.FILLED);
        store.reclassify(first);

        addAndClose("c2", "BTC-USDT", OrderStatus.FILLED);
        addAndClose("c3", "BTC-USDT", OrderStatus.FILLED);
        addAndClose("c4", "BTC-USDT", OrderStatus.FILLED);

        assertEquals(3, store.getHistoryCount());
        assertTrue(store.getByClientId("c1").isEmpty());
        assertTrue(store.getByExchangeId("X-1").isEmpty());
        assertTrue(store.getByClientId("c4").isPresent());
    }
}
