package io.cryptomm.engine.core.order;

import io.cryptomm.engine.core.model.Order;
import lombok.Value;

import java.util.List;

/**
 * One page of historical orders, newest first.
 */
@Value
public class OrderHistoryPage {
    List<Order> orders;
    int page;
    int pageSize;
    long total;

    public boolean isHasMore() {
        return (long) (page + 1) * pageSize < total;
    }
}
