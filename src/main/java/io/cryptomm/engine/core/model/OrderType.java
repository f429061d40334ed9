package io.cryptomm.engine.core.model;

public enum OrderType {
    LIMIT,
    MARKET
}
