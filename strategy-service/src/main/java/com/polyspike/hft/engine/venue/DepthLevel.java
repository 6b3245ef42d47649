package com.polyspike.hft.engine.venue;

import java.math.BigDecimal;

/**
 * One price level. A size of zero marks a price known only from the venue's price endpoint, without depth.
 */
public record DepthLevel(BigDecimal price, BigDecimal size) {

    public DepthLevel {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("price must be > 0");
        }
        size = size == null || size.signum() < 0 ? BigDecimal.ZERO : size;
    }

    public BigDecimal notional() {
        return price.multiply(size);
    }
}
