package io.cryptomm.engine.web.dto;

import io.cryptomm.engine.core.model.OffsetBasis;
import io.cryptomm.engine.core.model.SkewMode;
import io.cryptomm.engine.core.model.SkewTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Partial inventory config; null fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryConfigRequest {
    private BigDecimal maxInventory;
    private BigDecimal targetInventory;
    private SkewMode skewMode;
    private Double skewFactor;
    private List<SkewTier> tiers;
    private Double rebalanceThreshold;
    private Double emergencyThreshold;
    private OffsetBasis offsetBasis;
    private BigDecimal priceUnit;
}
