package io.cryptomm.engine.core.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class SlippageResult {
    BigDecimal avgPrice;
    // 0.01 = 1%
    BigDecimal slippagePct;
    BigDecimal totalCost;
}
