package io.cryptomm.engine.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderBookSnapshotRequest {
    private List<LevelDto> bids = new ArrayList<>();
    private List<LevelDto> asks = new ArrayList<>();
}
