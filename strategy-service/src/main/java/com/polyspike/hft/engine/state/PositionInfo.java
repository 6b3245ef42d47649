package com.polyspike.hft.engine.state;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A venue-reported or simulated holding.
 */
public record PositionInfo(
        String eventSlug,
        String outcome,
        String asset,
        BigDecimal avgPrice,
        BigDecimal shares,
        BigDecimal currentPrice,
        BigDecimal initialValue,
        BigDecimal currentValue,
        BigDecimal pnl,
        BigDecimal percentPnl,
        BigDecimal realizedPnl
) {

    /**
     * Builds a position valued at {@code currentPrice}, deriving values and PnL.
     */
    public static PositionInfo of(String eventSlug, String outcome, String asset, BigDecimal avgPrice,
                                  BigDecimal shares, BigDecimal currentPrice, BigDecimal realizedPnl) {
        BigDecimal mark = currentPrice != null ? currentPrice : avgPrice;
        BigDecimal initialValue = avgPrice.multiply(shares).setScale(6, RoundingMode.HALF_UP);
        BigDecimal currentValue = mark.multiply(shares).setScale(6, RoundingMode.HALF_UP);
        BigDecimal pnl = currentValue.subtract(initialValue);
        BigDecimal percentPnl = initialValue.signum() == 0
                ? BigDecimal.ZERO
                : pnl.divide(initialValue, 6, RoundingMode.HALF_UP).multiply(BigDecimal.valueOf(100));
        return new PositionInfo(eventSlug == null ? "" : eventSlug, outcome == null ? "" : outcome, asset,
                avgPrice, shares, mark, initialValue, currentValue, pnl, percentPnl,
                realizedPnl == null ? BigDecimal.ZERO : realizedPnl);
    }

    public PositionInfo withCurrentPrice(BigDecimal price) {
        return of(eventSlug, outcome, asset, avgPrice, shares, price, realizedPnl);
    }

    public boolean isValid() {
        return asset != null && !asset.isBlank()
                && shares != null && shares.signum() >= 0
                && avgPrice != null && avgPrice.signum() >= 0;
    }
}
