package com.polyspike.hft.engine.state;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * An open engine-managed trade. At most one exists per instrument.
 */
public record ActiveTrade(
        String instrument,
        BigDecimal entryPrice,
        Instant entryTime,
        BigDecimal amountUsd,
        BigDecimal shares,
        boolean triggeredBySystem
) {

    public ActiveTrade withShares(BigDecimal remaining) {
        BigDecimal amount = entryPrice.multiply(remaining).setScale(6, RoundingMode.HALF_UP);
        return new ActiveTrade(instrument, entryPrice, entryTime, amount, remaining, triggeredBySystem);
    }

    /**
     * Adds a further fill, keeping the original entry time and a share-weighted entry price.
     */
    ActiveTrade mergedWith(ActiveTrade other) {
        BigDecimal totalShares = shares.add(other.shares());
        if (totalShares.signum() <= 0) {
            return this;
        }
        BigDecimal weighted = entryPrice.multiply(shares)
                .add(other.entryPrice().multiply(other.shares()))
                .divide(totalShares, 6, RoundingMode.HALF_UP);
        Instant earliest = entryTime.isBefore(other.entryTime()) ? entryTime : other.entryTime();
        return new ActiveTrade(instrument, weighted, earliest, amountUsd.add(other.amountUsd()), totalShares,
                triggeredBySystem || other.triggeredBySystem());
    }
}
