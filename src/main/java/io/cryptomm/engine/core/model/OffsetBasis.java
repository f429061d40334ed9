package io.cryptomm.engine.core.model;

/**
 * Price unit that the skew is scaled by when quotes are adjusted.
 */
public enum OffsetBasis {
    HALF_SPREAD,
    PRICE_UNIT,
    MID_PRICE
}
