package com.polyspike.hft.engine.venue;

import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.polymarket.model.ClobOrderType;

import java.math.BigDecimal;

/**
 * Order sent to the venue. For market (FOK/FAK) BUY orders {@code amount} is USDC; otherwise it is shares.
 * {@code price} is the limit, or the worst acceptable price for market orders.
 */
public record VenueOrder(String instrument, OrderSide side, BigDecimal amount, BigDecimal price, ClobOrderType orderType) {

    public static VenueOrder fokBuy(String instrument, BigDecimal usdAmount, BigDecimal worstPrice) {
        return new VenueOrder(instrument, OrderSide.BUY, usdAmount, worstPrice, ClobOrderType.FOK);
    }

    public static VenueOrder fokSell(String instrument, BigDecimal shares, BigDecimal worstPrice) {
        return new VenueOrder(instrument, OrderSide.SELL, shares, worstPrice, ClobOrderType.FOK);
    }

    public static VenueOrder gtc(String instrument, OrderSide side, BigDecimal shares, BigDecimal price) {
        return new VenueOrder(instrument, side, shares, price, ClobOrderType.GTC);
    }

    public boolean resting() {
        return orderType == ClobOrderType.GTC;
    }
}
