package io.cryptomm.engine.exchange;

import java.util.List;
import java.util.Optional;

/**
 * Trading capability of a single venue. Implementations block on network I/O;
 * callers bound them with their own timeouts.
 * All methods throw {@link io.cryptomm.engine.core.exception.ExchangeException}
 * on transport, authentication or venue errors.
 */
public interface ExchangeClient {

    String getName();

    ExchangeOrderAck submitOrder(ExchangeOrderRequest request);

    void cancelOrder(String symbol, String exchangeOrderId);

    /**
     * @param symbol optional filter, null for every symbol
     * @return number of orders the venue cancelled
     */
    int cancelAllOrders(String symbol);

    Optional<ExchangeOrderState> getOrder(String symbol, String exchangeOrderId);

    /**
     * @param symbol optional filter, null for every symbol
     */
    List<ExchangeOrderState> getOpenOrders(String symbol);

    List<Balance> getBalance();

    List<Position> getPositions();
}
