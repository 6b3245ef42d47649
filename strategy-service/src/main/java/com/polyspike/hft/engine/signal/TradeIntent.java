package com.polyspike.hft.engine.signal;

import com.polyspike.hft.domain.OrderSide;

import java.math.BigDecimal;

/**
 * What a strategy wants done. QUOTE intents carry a side, price and size for a resting order.
 */
public record TradeIntent(
        String instrument,
        Action action,
        String reason,
        String strategy,
        OrderSide side,
        BigDecimal quotePrice,
        BigDecimal quoteSize
) {

    public enum Action {
        BUY,
        SELL,
        QUOTE,
    }

    public static TradeIntent buy(String instrument, String reason, String strategy) {
        return new TradeIntent(instrument, Action.BUY, reason, strategy, OrderSide.BUY, null, null);
    }

    public static TradeIntent sell(String instrument, String reason, String strategy) {
        return new TradeIntent(instrument, Action.SELL, reason, strategy, OrderSide.SELL, null, null);
    }

    public static TradeIntent quote(String instrument, OrderSide side, BigDecimal price, BigDecimal size, String strategy) {
        return new TradeIntent(instrument, Action.QUOTE, "passive quote", strategy, side, price, size);
    }

    /**
     * Identity used to drop duplicates within one scan.
     */
    String dedupKey() {
        return instrument + "|" + action + "|" + side;
    }
}
