package io.cryptomm.engine.core.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class InventoryStats {
    String symbol;
    BigDecimal currentInventory;
    double ratio;
    double skew;
    BigDecimal peakInventory;
    BigDecimal totalBought;
    BigDecimal totalSold;
    long fillCount;
    long rebalanceCount;
    boolean needsRebalance;
    boolean emergency;
}
