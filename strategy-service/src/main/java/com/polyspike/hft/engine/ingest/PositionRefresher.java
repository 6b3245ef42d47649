package com.polyspike.hft.engine.ingest;

import com.polyspike.hft.engine.state.PositionInfo;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.supervisor.SupervisedTask;
import com.polyspike.hft.polymarket.data.PolymarketDataApiClient;
import com.polyspike.hft.polymarket.data.PolymarketPosition;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Live mode only: replaces the positions snapshot with what the data API reports for the wallet.
 */
@Slf4j
public class PositionRefresher implements SupervisedTask {

    private static final int PAGE_SIZE = 500;
    private static final int MAX_PAGES = 20;

    private final TradingState state;
    private final PolymarketDataApiClient dataApi;
    private final String userAddress;
    private final Duration interval;

    public PositionRefresher(TradingState state, PolymarketDataApiClient dataApi, String userAddress, Duration interval) {
        this.state = Objects.requireNonNull(state, "state");
        this.dataApi = Objects.requireNonNull(dataApi, "dataApi");
        if (userAddress == null || userAddress.isBlank()) {
            throw new IllegalStateException("hft.polymarket.user-address is required to refresh positions");
        }
        this.userAddress = userAddress.trim();
        this.interval = Objects.requireNonNull(interval, "interval");
    }

    @Override
    public String name() {
        return "position-refresher";
    }

    @Override
    public void run() throws InterruptedException {
        while (!state.isShutdown()) {
            try {
                refreshOnce();
            } catch (RuntimeException e) {
                log.warn("INGEST: positions refresh failed: {}", e.toString());
            }
            if (state.awaitShutdown(interval)) {
                return;
            }
        }
    }

    int refreshOnce() {
        List<PolymarketPosition> positions = dataApi.getAllPositions(userAddress, PAGE_SIZE, MAX_PAGES);
        Map<String, List<PositionInfo>> snapshot = toSnapshot(positions);
        state.replacePositions(snapshot);
        log.debug("INGEST: positions refreshed ({} markets, {} holdings)", snapshot.size(), positions.size());
        return positions.size();
    }

    /**
     * Groups venue positions by market (condition id, else event slug).
     */
    public static Map<String, List<PositionInfo>> toSnapshot(List<PolymarketPosition> positions) {
        Map<String, List<PositionInfo>> out = new LinkedHashMap<>();
        for (PolymarketPosition p : positions) {
            if (p == null || p.asset() == null || p.asset().isBlank()) {
                continue;
            }
            String key = p.marketKey() == null || p.marketKey().isBlank() ? p.asset() : p.marketKey();
            out.computeIfAbsent(key, k -> new ArrayList<>()).add(toPositionInfo(p));
        }
        return out;
    }

    static PositionInfo toPositionInfo(PolymarketPosition p) {
        BigDecimal avg = p.avgPrice() == null ? BigDecimal.ZERO : p.avgPrice();
        BigDecimal shares = p.size() == null ? BigDecimal.ZERO : p.size();
        return PositionInfo.of(p.eventSlug(), p.outcome(), p.asset(), avg, shares, p.curPrice(), p.realizedPnl());
    }
}
