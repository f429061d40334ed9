package io.cryptomm.engine.core.order;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrderManagerStats {
    int activeOrders;
    int historicalOrders;
    long submitted;
    long rejected;
    long cancelled;
    long filled;
    long ignoredEvents;
}
