package io.cryptomm.engine.exchange;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.event.OrderFillEvent;
import io.cryptomm.engine.core.exception.ExchangeException;
import io.cryptomm.engine.core.model.Level;
import io.cryptomm.engine.core.model.OrderSide;
import io.cryptomm.engine.core.model.OrderStatus;
import io.cryptomm.engine.core.model.OrderType;
import io.cryptomm.engine.core.orderbook.OrderBookManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SimulatedExchangeClientTest {

    private static final String SYMBOL = "BTC-USDT";

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private EngineProperties properties;
    private OrderBookManager orderBookManager;
    private SimulatedExchangeClient client;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        properties.getExchange().setApiKey("paper-key");
        properties.getExchange().setApiSecret("paper-secret");
        properties.getExchange().getBalances().put("USDT", new BigDecimal("1000"));
        orderBookManager = new OrderBookManager();
        orderBookManager.applySnapshot(SYMBOL,
                List.of(Level.of("99", "1"), Level.of("98", "2")),
                List.of(Level.of("101", "1"), Level.of("102", "2")),
                Instant.now());
        client = new SimulatedExchangeClient(properties, orderBookManager, eventPublisher);
    }

    private ExchangeOrderRequest request(OrderSide side, OrderType type, String price, String quantity) {
        return ExchangeOrderRequest.builder()
                .clientOrderId("mm-1-" + side)
                .symbol(SYMBOL)
                .side(side)
                .type(type)
                .price(price == null ? null : new BigDecimal(price))
                .quantity(new BigDecimal(quantity))
                .build();
    }

    @Test
    void testLimitOrderRests() {
        ExchangeOrderAck ack = client.submitOrder(request(OrderSide.BUY, OrderType.LIMIT, "100", "1"));

        assertEquals(OrderStatus.SUBMITTED, ack.getStatus());
        assertTrue(ack.getExchangeOrderId().startsWith("SIM-"));
        assertEquals(1, client.getOpenOrders(SYMBOL).size());
        assertEquals("mm-1-BUY", client.getOrder(SYMBOL, ack.getExchangeOrderId()).orElseThrow().getClientOrderId());
    }

    @Test
    void testMarketOrderFillsAgainstBook() {
        // 1 @ 101 + 1 @ 102
        ExchangeOrderAck ack = client.submitOrder(request(OrderSide.BUY, OrderType.MARKET, null, "2"));

        assertEquals(OrderStatus.FILLED, ack.getStatus());
        assertEquals(0, new BigDecimal("101.5").compareTo(ack.getAvgFillPrice()));
        Position position = client.getPositions().get(0);
        assertEquals(OrderSide.BUY, position.getSide());
        assertEquals(0, new BigDecimal("2").compareTo(position.getSize()));
        assertTrue(client.getOpenOrders(SYMBOL).isEmpty());
    }

    @Test
    void testMarketOrderWithoutLiquidity() {
        ExchangeOrderAck ack = client.submitOrder(request(OrderSide.SELL, OrderType.MARKET, null, "5"));

        assertEquals(OrderStatus.REJECTED, ack.getStatus());
        assertTrue(client.getPositions().isEmpty());
    }

    @Test
    void testMissingCredentials() {
        // construction succeeds, signing is deferred
        properties.getExchange().setApiSecret(null);
        SimulatedExchangeClient unsigned = new SimulatedExchangeClient(properties, orderBookManager, eventPublisher);

        assertEquals("simulated", unsigned.getName());
        assertThrows(ExchangeException.class,
                () -> unsigned.submitOrder(request(OrderSide.BUY, OrderType.LIMIT, "100", "1")));
    }

    @Test
    void testCancelOrder() {
        String id = client.submitOrder(request(OrderSide.SELL, OrderType.LIMIT, "105", "1")).getExchangeOrderId();

        client.cancelOrder(SYMBOL, id);

        assertEquals(OrderStatus.CANCELLED, client.getOrder(SYMBOL, id).orElseThrow().getStatus());
        assertThrows(ExchangeException.class, () -> client.cancelOrder(SYMBOL, id));
        assertThrows(ExchangeException.class, () -> client.cancelOrder(SYMBOL, "SIM-999"));
    }

    @Test
    void testCancelAllOrdersBySymbol() {
        client.submitOrder(request(OrderSide.BUY, OrderType.LIMIT, "97", "1"));
        client.submitOrder(request(OrderSide.SELL, OrderType.LIMIT, "103", "1"));
        client.submitOrder(ExchangeOrderRequest.builder()
                .clientOrderId("eth-1").symbol("ETH-USDT").side(OrderSide.BUY).type(OrderType.LIMIT)
                .price(BigDecimal.TEN).quantity(BigDecimal.ONE).build());

        assertEquals(2, client.cancelAllOrders(SYMBOL));
        assertEquals(1, client.getOpenOrders(null).size());
    }

    @Test
    void testSimulateFill() {
        String id = client.submitOrder(request(OrderSide.SELL, OrderType.LIMIT, "105", "2")).getExchangeOrderId();

        client.simulateFill(id, BigDecimal.ONE, new BigDecimal("105"));
        client.simulateFill(id, BigDecimal.ONE, new BigDecimal("106"));

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(events.capture());
        OrderFillEvent last = (OrderFillEvent) events.getAllValues().get(1);
        assertEquals(id, last.getOrderId());
        assertEquals(0, new BigDecimal("2").compareTo(last.getTotalFilled()));

        ExchangeOrderState state = client.getOrder(SYMBOL, id).orElseThrow();
        assertEquals(OrderStatus.FILLED, state.getStatus());
        assertEquals(0, new BigDecimal("105.5").compareTo(state.getAvgFillPrice()));
        assertEquals(OrderSide.SELL, client.getPositions().get(0).getSide());
    }

    @Test
    void testSimulateOverfill() {
        String id = client.submitOrder(request(OrderSide.BUY, OrderType.LIMIT, "100", "1")).getExchangeOrderId();

        assertThrows(ExchangeException.class, () -> client.simulateFill(id, new BigDecimal("1.5"), new BigDecimal("100")));
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void testBalance() {
        List<Balance> balances = client.getBalance();

        assertEquals(1, balances.size());
        assertEquals("USDT", balances.get(0).getAsset());
    }
}
