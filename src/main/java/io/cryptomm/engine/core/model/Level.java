package io.cryptomm.engine.core.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Aggregated price level of an L2 book. Levels are ordered and compared by
 * price only; {@code 100} and {@code 100.00} are the same level.
 */
@Value
public class Level implements Comparable<Level> {
    public static final Comparator<Level> BY_PRICE_ASCENDING = Comparator.naturalOrder();
    public static final Comparator<Level> BY_PRICE_DESCENDING = BY_PRICE_ASCENDING.reversed();

    BigDecimal price;
    BigDecimal size;
    int numOrders;

    public static Level of(BigDecimal price, BigDecimal size, int numOrders) {
        return new Level(price, size, numOrders);
    }

    public static Level of(String price, String size) {
        return new Level(new BigDecimal(price), new BigDecimal(size), 1);
    }

    public boolean samePrice(BigDecimal other) {
        return price.compareTo(other) == 0;
    }

    public BigDecimal notional() {
        return price.multiply(size);
    }

    @Override
    public int compareTo(Level other) {
        return price.compareTo(other.price);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Level other)) {
            return false;
        }
        return samePrice(other.price);
    }

    @Override
    public int hashCode() {
        return price.stripTrailingZeros().hashCode();
    }
}
