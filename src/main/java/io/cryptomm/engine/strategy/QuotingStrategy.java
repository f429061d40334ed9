package io.cryptomm.engine.strategy;

import io.cryptomm.engine.core.exception.InvalidConfigurationException;

/**
 * A strategy that maintains quotes on one instrument.
 */
public interface QuotingStrategy extends StrategyListener {

    /**
     * Validates and stages new parameters. They take effect at the next tick.
     *
     * @throws InvalidConfigurationException if the parameters are rejected
     */
    void updateParams(StrategyParams params);

    void validateParams(StrategyParams params);

    StrategyParams getParams();

    /**
     * One quoting cycle.
     */
    void onTick();
}
