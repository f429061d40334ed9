package io.cryptomm.engine.core.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class Quote {
    BigDecimal bid;
    BigDecimal ask;
}
