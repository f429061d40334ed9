package io.cryptomm.engine.web.dto;

import io.cryptomm.engine.core.model.Level;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LevelDto {
    private BigDecimal price;
    private BigDecimal size;
    private int numOrders;

    public static LevelDto from(Level level) {
        return new LevelDto(level.getPrice(), level.getSize(), level.getNumOrders());
    }

    public Level toLevel() {
        if (price == null || size == null) {
            throw new IllegalArgumentException("Level price and size are required");
        }
        return Level.of(price, size, numOrders);
    }
}
