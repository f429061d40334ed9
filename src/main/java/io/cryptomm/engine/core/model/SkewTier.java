package io.cryptomm.engine.core.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkewTier {
    // Lower bound of |inventory / maxInventory| this tier applies from
    private double threshold;
    private double multiplier;
}
