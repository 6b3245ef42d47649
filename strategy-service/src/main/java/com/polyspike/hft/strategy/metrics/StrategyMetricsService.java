package com.polyspike.hft.strategy.metrics;

import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.supervisor.WorkerSupervisor;
import com.polyspike.hft.metrics.PolyspikeMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics service for strategy-service.
 * Tracks balance, realized PnL, order outcomes and engine gauges.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StrategyMetricsService {

    private final PolyspikeMetrics metrics;

    // Ledger gauges
    private AtomicReference<BigDecimal> balance;
    private AtomicReference<BigDecimal> realizedPnl;

    // Order counters
    private Counter buysFilled;
    private Counter sellsFilled;
    private Counter ordersRejected;
    private Counter ordersFailed;
    private Counter quotesPlaced;
    private Counter intentsDropped;

    @PostConstruct
    public void initializeMetrics() {
        log.info("Initializing strategy metrics...");

        balance = metrics.registerAtomicBigDecimalGauge(
                "polyspike_strategy_balance_usd",
                "Available USDC (simulated ledger in PAPER mode)",
                BigDecimal.ZERO
        );

        realizedPnl = metrics.registerAtomicBigDecimalGauge(
                "polyspike_strategy_realized_pnl_usd",
                "Realized PnL in USD since service start",
                BigDecimal.ZERO
        );

        buysFilled = metrics.createCounter(
                "polyspike_engine_orders_filled_total",
                "Orders filled",
                Tag.of("side", OrderSide.BUY.name())
        );
        sellsFilled = metrics.createCounter(
                "polyspike_engine_orders_filled_total",
                "Orders filled",
                Tag.of("side", OrderSide.SELL.name())
        );
        ordersRejected = metrics.createCounter(
                "polyspike_engine_orders_rejected_total",
                "Orders skipped by a trading precondition or refused by the venue"
        );
        ordersFailed = metrics.createCounter(
                "polyspike_engine_orders_failed_total",
                "Orders that failed after retries or whose outcome is unknown"
        );
        quotesPlaced = metrics.createCounter(
                "polyspike_engine_quotes_placed_total",
                "Passive quotes placed"
        );
        intentsDropped = metrics.createCounter(
                "polyspike_engine_intents_dropped_total",
                "Intents skipped because the dispatch queue was full"
        );

        log.info("Strategy metrics initialized successfully");
    }

    /**
     * Registers gauges read straight from the running engine.
     */
    public void bindEngine(TradingState state, WorkerSupervisor supervisor) {
        metrics.registerIntGauge(
                "polyspike_engine_active_trades",
                "Open engine-managed trades",
                state::activeTradeCount
        );
        metrics.registerIntGauge(
                "polyspike_engine_tracked_instruments",
                "Instruments on the watchlist",
                () -> state.trackedInstruments().size()
        );
        metrics.registerIntGauge(
                "polyspike_engine_reserved_trade_slots",
                "Trade slots currently reserved",
                state::reservedTradeSlots
        );
        metrics.registerIntGauge(
                "polyspike_engine_active_tasks",
                "Supervised tasks currently alive",
                supervisor::activeTaskCount
        );
        metrics.registerIntGauge(
                "polyspike_engine_task_restarts",
                "Supervised task restarts since start",
                () -> (int) supervisor.totalRestarts()
        );
        metrics.registerBooleanGauge(
                "polyspike_engine_shutting_down",
                "1 once shutdown has been requested",
                state::isShutdown
        );
    }

    public void recordFill(OrderSide side) {
        (side == OrderSide.BUY ? buysFilled : sellsFilled).increment();
    }

    public void recordRejected() {
        ordersRejected.increment();
    }

    public void recordFailed() {
        ordersFailed.increment();
    }

    public void recordQuotePlaced() {
        quotesPlaced.increment();
    }

    public void recordIntentDropped() {
        intentsDropped.increment();
    }

    public void updateBalance(BigDecimal amount) {
        balance.set(amount != null ? amount : BigDecimal.ZERO);
    }

    public void addToRealizedPnl(BigDecimal delta) {
        if (delta != null) {
            realizedPnl.updateAndGet(current -> current.add(delta));
        }
    }
}
