package io.cryptomm.engine.core.stream;

import io.cryptomm.engine.config.EngineProperties;
import io.cryptomm.engine.core.event.OrderFillEvent;
import io.cryptomm.engine.core.event.OrderUpdateEvent;
import io.cryptomm.engine.core.model.OrderStatus;
import io.cryptomm.engine.core.order.OrderManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class OrderEventDispatcherTest {

    private OrderManager orderManager;
    private OrderEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        orderManager = mock(OrderManager.class);
        dispatcher = new OrderEventDispatcher(orderManager, new EngineProperties());
        dispatcher.start();
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    private static OrderFillEvent fill(String orderId) {
        return OrderFillEvent.builder().orderId(orderId).fillQuantity(BigDecimal.ONE).fillPrice(BigDecimal.TEN).build();
    }

    private static OrderUpdateEvent update(String orderId) {
        return OrderUpdateEvent.builder().orderId(orderId).status(OrderStatus.SUBMITTED).build();
    }

    @Test
    void testArrivalOrder() {
        OrderUpdateEvent first = update("X-1");
        OrderFillEvent second = fill("X-1");
        OrderUpdateEvent third = update("X-2");

        dispatcher.submit(first);
        dispatcher.submit(second);
        dispatcher.submit(third);

        verify(orderManager, timeout(2000)).handleOrderUpdate(third);
        InOrder order = inOrder(orderManager);
        order.verify(orderManager).handleOrderUpdate(first);
        order.verify(orderManager).handleOrderFill(second);
        order.verify(orderManager).handleOrderUpdate(third);
    }

    @Test
    void testFailingEvent() {
        OrderFillEvent bad = fill("bad");
        OrderFillEvent good = fill("good");
        doThrow(new IllegalStateException("corrupt")).when(orderManager).handleOrderFill(bad);

        dispatcher.submit(bad);
        dispatcher.submit(good);

        verify(orderManager, timeout(2000)).handleOrderFill(good);
        assertTrue(dispatcher.isRunning());
    }

    @Test
    void testEventListenerEntryPoints() {
        OrderFillEvent event = fill("X-3");

        dispatcher.onOrderFill(event);

        verify(orderManager, timeout(2000)).handleOrderFill(event);
    }

    @Test
    void testStop() {
        assertTrue(dispatcher.isRunning());

        dispatcher.stop();

        assertFalse(dispatcher.isRunning());
    }
}
