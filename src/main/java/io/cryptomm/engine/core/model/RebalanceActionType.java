package io.cryptomm.engine.core.model;

public enum RebalanceActionType {
    NONE,
    LIMIT_ORDER,
    MARKET_ORDER,
    EMERGENCY_STOP
}
