package com.polyspike.hft.engine.execution;

import com.polyspike.hft.domain.OrderSide;

import java.math.BigDecimal;

/**
 * Payload published for every executed order.
 */
public record TradeEvent(
        String instrument,
        OrderSide side,
        BigDecimal shares,
        BigDecimal price,
        String reason,
        boolean simulated
) {
}
