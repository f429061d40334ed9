package io.cryptomm.engine.strategy;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class StrategyParams {
    String symbol;
    // Full quoted spread around mid, in basis points
    int spreadBps;
    BigDecimal orderQuantity;
    @Builder.Default
    int orderLevels = 1;
    // Extra distance per level beyond the first
    @Builder.Default
    int levelSpreadBps = 5;
    // Requote when mid moved by more than this
    int minRefreshBps;
    // Requote at least every this many ticks
    @Builder.Default
    int orderTtlTicks = 60;
}
