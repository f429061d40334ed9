package io.cryptomm.engine.core.model;

public enum SkewMode {
    LINEAR,
    EXPONENTIAL,
    TIERED
}
