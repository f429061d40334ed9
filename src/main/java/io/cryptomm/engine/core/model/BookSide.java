package io.cryptomm.engine.core.model;

public enum BookSide {
    BID,
    ASK;

    public BookSide opposite() {
        return this == BID ? ASK : BID;
    }
}
