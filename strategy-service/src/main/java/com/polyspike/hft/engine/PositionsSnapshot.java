package com.polyspike.hft.engine;

import com.polyspike.hft.engine.state.PositionInfo;
import com.polyspike.hft.engine.state.PricePoint;
import com.polyspike.hft.engine.state.TradingState;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Positions grouped by market, marked at the latest observed price, with portfolio totals.
 */
public record PositionsSnapshot(Map<String, List<PositionInfo>> positions, Totals totals) {

    public static PositionsSnapshot capture(TradingState state) {
        Map<String, List<PositionInfo>> marked = new LinkedHashMap<>();
        BigDecimal initial = BigDecimal.ZERO;
        BigDecimal current = BigDecimal.ZERO;
        BigDecimal realized = BigDecimal.ZERO;
        int count = 0;
        for (Map.Entry<String, List<PositionInfo>> entry : state.getPositions().entrySet()) {
            List<PositionInfo> list = new ArrayList<>(entry.getValue().size());
            for (PositionInfo p : entry.getValue()) {
                Optional<PricePoint> last = state.latestPrice(p.asset());
                PositionInfo m = last.isPresent() ? p.withCurrentPrice(last.get().price()) : p;
                list.add(m);
                initial = initial.add(m.initialValue());
                current = current.add(m.currentValue());
                realized = realized.add(m.realizedPnl());
                count++;
            }
            marked.put(entry.getKey(), List.copyOf(list));
        }
        BigDecimal pnl = current.subtract(initial);
        BigDecimal pct = initial.signum() == 0
                ? BigDecimal.ZERO
                : pnl.divide(initial, 6, RoundingMode.HALF_UP).multiply(BigDecimal.valueOf(100));
        return new PositionsSnapshot(marked, new Totals(count, initial, current, pnl, pct, realized));
    }

    public record Totals(
            int positions,
            BigDecimal initialValue,
            BigDecimal currentValue,
            BigDecimal pnl,
            BigDecimal percentPnl,
            BigDecimal realizedPnl
    ) {
    }
}
