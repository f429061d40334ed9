package io.cryptomm.engine.core.model;

public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Book side a resting order of this side lives on.
     */
    public BookSide bookSide() {
        return this == BUY ? BookSide.BID : BookSide.ASK;
    }
}
