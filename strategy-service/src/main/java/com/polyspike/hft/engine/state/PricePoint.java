package com.polyspike.hft.engine.state;

import java.math.BigDecimal;
import java.time.Instant;

public record PricePoint(Instant timestamp, BigDecimal price, String eventSlug, String outcome) {
}
