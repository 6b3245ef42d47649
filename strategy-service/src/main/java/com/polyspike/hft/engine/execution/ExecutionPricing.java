package com.polyspike.hft.engine.execution;

import com.polyspike.hft.engine.venue.DepthLevel;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Depth-aware execution price for a sell against the bid side.
 */
@UtilityClass
public class ExecutionPricing {

    private static final int PRICE_SCALE = 6;

    /**
     * Fills {@code targetShares} against {@code levels} (best first). The top price is used when the best level
     * covers the target; otherwise the size-weighted average across levels. Levels without size add no depth.
     */
    public static Fill sweep(List<DepthLevel> levels, BigDecimal targetShares) {
        if (levels == null || levels.isEmpty() || targetShares == null || targetShares.signum() <= 0) {
            return Fill.NONE;
        }
        DepthLevel top = levels.get(0);
        if (top.size().compareTo(targetShares) >= 0) {
            return new Fill(targetShares, top.price(), top.price(), false);
        }

        BigDecimal remaining = targetShares;
        BigDecimal filled = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        BigDecimal worst = null;
        for (DepthLevel level : levels) {
            if (remaining.signum() <= 0) {
                break;
            }
            if (level.size().signum() <= 0) {
                continue;
            }
            BigDecimal take = level.size().min(remaining);
            filled = filled.add(take);
            notional = notional.add(take.multiply(level.price()));
            remaining = remaining.subtract(take);
            worst = level.price();
        }
        if (filled.signum() <= 0) {
            return Fill.NONE;
        }
        BigDecimal avg = notional.divide(filled, PRICE_SCALE, RoundingMode.HALF_UP);
        return new Fill(filled, avg, worst, remaining.signum() > 0);
    }

    /**
     * @param partial the book could not absorb the full target
     */
    public record Fill(BigDecimal shares, BigDecimal avgPrice, BigDecimal worstPrice, boolean partial) {

        static final Fill NONE = new Fill(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, true);

        public boolean isEmpty() {
            return shares.signum() <= 0;
        }
    }
}
