package io.cryptomm.engine.strategy;

import io.cryptomm.engine.core.model.Order;

/**
 * Callbacks from the order manager. Invoked on the event ingestion thread (or
 * the caller's thread for synchronous operations), never while the order
 * manager holds its lock. Orders passed in are copies.
 */
public interface StrategyListener {

    /**
     * Every applied status or fill change, partial fills included.
     */
    void onOrderUpdate(Order order);

    /**
     * Once per order, when it becomes FILLED. Follows the matching {@link #onOrderUpdate}.
     */
    void onOrderFill(Order order);
}
