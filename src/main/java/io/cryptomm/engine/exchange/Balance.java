package io.cryptomm.engine.exchange;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class Balance {
    String asset;
    BigDecimal total;
    BigDecimal available;
    // Held by open orders
    BigDecimal locked;
}
