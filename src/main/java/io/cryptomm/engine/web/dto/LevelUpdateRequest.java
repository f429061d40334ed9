package io.cryptomm.engine.web.dto;

import io.cryptomm.engine.core.model.BookSide;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LevelUpdateRequest {
    private BookSide side;
    private BigDecimal price;
    // Zero removes the level
    private BigDecimal size;
    private int numOrders;
}
