package com.polyspike.hft.engine;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.state.PositionInfo;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.supervisor.SupervisedTask;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Periodic status line plus a throttled positions/PnL dump.
 */
@Slf4j
class StatusReporter implements SupervisedTask {

    private final TradingState state;
    private final Supplier<EngineStatus> status;
    private final HftProperties.Status config;

    StatusReporter(TradingState state, Supplier<EngineStatus> status, HftProperties.Status config) {
        this.state = state;
        this.status = status;
        this.config = config;
    }

    @Override
    public String name() {
        return "status-reporter";
    }

    @Override
    public void run() throws InterruptedException {
        long interval = Math.min(config.logIntervalMillis(), config.positionsLogIntervalMillis());
        long sinceStatus = config.logIntervalMillis();
        long sincePositions = 0L;
        while (!state.isShutdown()) {
            if (sinceStatus >= config.logIntervalMillis()) {
                logStatus();
                sinceStatus = 0L;
            }
            if (sincePositions >= config.positionsLogIntervalMillis()) {
                logPositions();
                sincePositions = 0L;
            }
            if (state.awaitShutdown(Duration.ofMillis(interval))) {
                return;
            }
            sinceStatus += interval;
            sincePositions += interval;
        }
    }

    private void logStatus() {
        EngineStatus s = status.get();
        log.info("STATUS: mode={} running={} tasks={} instruments={} activeTrades={} balance={} scans={}",
                s.mode(), s.running(), s.activeTasks(), s.trackedInstruments(), s.activeTrades(),
                s.simulatedBalance(), s.scans());
    }

    private void logPositions() {
        PositionsSnapshot snapshot = PositionsSnapshot.capture(state);
        if (snapshot.totals().positions() == 0) {
            return;
        }
        for (Map.Entry<String, List<PositionInfo>> entry : snapshot.positions().entrySet()) {
            for (PositionInfo p : entry.getValue()) {
                log.info("STATUS:   {} {} | shares={} avg={} cur={} pnl={} ({}%)",
                        p.eventSlug().isEmpty() ? entry.getKey() : p.eventSlug(), p.outcome(),
                        p.shares(), p.avgPrice(), p.currentPrice(), p.pnl(), p.percentPnl());
            }
        }
        PositionsSnapshot.Totals t = snapshot.totals();
        log.info("STATUS: positions={} invested={} value={} pnl={} ({}%) realized={}",
                t.positions(), t.initialValue(), t.currentValue(), t.pnl(), t.percentPnl(), t.realizedPnl());
    }
}
