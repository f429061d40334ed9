package io.cryptomm.engine.core.inventory;

import io.cryptomm.engine.core.exception.InvalidConfigurationException;
import io.cryptomm.engine.core.model.OffsetBasis;
import io.cryptomm.engine.core.model.SkewMode;
import io.cryptomm.engine.core.model.SkewTier;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Inventory risk parameters for one instrument.
 */
@Value
@Builder(toBuilder = true)
public class InventoryConfig {
    static final List<SkewTier> DEFAULT_TIERS = List.of(
            new SkewTier(0.0, 1.0),
            new SkewTier(0.4, 1.5),
            new SkewTier(0.7, 2.0));

    BigDecimal maxInventory;
    @Builder.Default
    BigDecimal targetInventory = BigDecimal.ZERO;
    @Builder.Default
    SkewMode skewMode = SkewMode.LINEAR;
    @Builder.Default
    double skewFactor = 0.5;
    @Singular
    List<SkewTier> tiers;
    @Builder.Default
    double rebalanceThreshold = 0.8;
    @Builder.Default
    double emergencyThreshold = 0.95;
    @Builder.Default
    OffsetBasis offsetBasis = OffsetBasis.HALF_SPREAD;
    BigDecimal priceUnit;

    /**
     * Tiers used by TIERED mode; the built-in ladder when none are configured.
     */
    public List<SkewTier> effectiveTiers() {
        return tiers.isEmpty() ? DEFAULT_TIERS : tiers;
    }

    public void validate() {
        if (maxInventory == null || maxInventory.signum() <= 0) {
            throw new InvalidConfigurationException("maxInventory must be positive, got " + maxInventory);
        }
        if (targetInventory == null) {
            throw new InvalidConfigurationException("targetInventory is required");
        }
        if (skewMode == null || offsetBasis == null) {
            throw new InvalidConfigurationException("skewMode and offsetBasis are required");
        }
        if (Double.isNaN(skewFactor) || skewFactor < 0.0 || skewFactor > 1.0) {
            throw new InvalidConfigurationException("skewFactor must be within [0, 1], got " + skewFactor);
        }
        if (rebalanceThreshold <= 0.0 || rebalanceThreshold > 1.0) {
            throw new InvalidConfigurationException("rebalanceThreshold must be within (0, 1], got " + rebalanceThreshold);
        }
        if (emergencyThreshold <= rebalanceThreshold || emergencyThreshold > 1.0) {
            throw new InvalidConfigurationException("emergencyThreshold must be within (rebalanceThreshold, 1], got "
                    + emergencyThreshold);
        }
        if (offsetBasis == OffsetBasis.PRICE_UNIT && (priceUnit == null || priceUnit.signum() <= 0)) {
            throw new InvalidConfigurationException("PRICE_UNIT offset basis needs a positive priceUnit");
        }

        double previous = Double.NEGATIVE_INFINITY;
        for (SkewTier tier : tiers) {
            if (tier.getThreshold() < 0.0 || tier.getMultiplier() < 0.0) {
                throw new InvalidConfigurationException("Skew tier values must be non-negative: " + tier);
            }
            if (tier.getThreshold() <= previous) {
                throw new InvalidConfigurationException("Skew tiers must be sorted ascending by threshold");
            }
            previous = tier.getThreshold();
        }
    }
}
