package io.cryptomm.engine.web.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
public class OrderBookDto {
    private String symbol;
    private int depth;
    private List<LevelDto> bids;
    private List<LevelDto> asks;
    private BigDecimal midPrice;
    private BigDecimal spread;
    private long sequence;
    private Instant lastUpdateTime;
}
