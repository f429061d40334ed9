package io.cryptomm.engine.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulatedFillRequest {
    private BigDecimal quantity;
    private BigDecimal price;
}
