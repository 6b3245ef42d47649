package com.polyspike.hft.engine.signal;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.execution.OrderExecutor;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.supervisor.SupervisedTask;
import com.polyspike.hft.strategy.metrics.StrategyMetricsService;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one {@link SignalStrategy} whenever fresh prices arrive and hands its intents to the order executor through a
 * bounded dispatch pool. A full queue drops the intent.
 */
@Slf4j
public class SignalDetector implements SupervisedTask {

    private static final Duration SCAN_LOG_INTERVAL = Duration.ofSeconds(5);

    private final SignalStrategy strategy;
    private final TradingState state;
    private final OrderExecutor executor;
    private final HftProperties.Detector config;
    private final Clock clock;
    private final StrategyMetricsService metrics;

    private volatile Instant lastScanLogAt = Instant.EPOCH;

    public SignalDetector(SignalStrategy strategy,
                          TradingState state,
                          OrderExecutor executor,
                          HftProperties.Detector config,
                          Clock clock,
                          StrategyMetricsService metrics) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.state = Objects.requireNonNull(state, "state");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public String name() {
        return "detector-" + strategy.name();
    }

    @Override
    public void run() throws InterruptedException {
        ThreadPoolExecutor dispatch = newDispatchPool();
        Duration wait = Duration.ofMillis(config.waitTimeoutMillis());
        long seen = 0L;
        try {
            while (!state.isShutdown()) {
                long version = state.awaitPriceUpdate(seen, wait);
                boolean fresh = version != seen;
                seen = version;
                if (state.isShutdown()) {
                    break;
                }
                if (!fresh && !strategy.evaluatesOnIdle()) {
                    continue;
                }
                try {
                    scanOnce(dispatch);
                } catch (RuntimeException e) {
                    log.error("DETECTOR: {} scan failed: {}", strategy.name(), e.toString(), e);
                    state.awaitShutdown(wait);
                }
            }
        } finally {
            dispatch.shutdown();
            if (!dispatch.awaitTermination(wait.toMillis() * 5, TimeUnit.MILLISECONDS)) {
                log.warn("DETECTOR: {} dispatch pool still busy at exit", strategy.name());
            }
        }
    }

    /**
     * Evaluates the strategy once and dispatches its de-duplicated intents. Returns how many were accepted.
     */
    int scanOnce(Executor dispatch) {
        Instant now = clock.instant();
        List<TradeIntent> intents = strategy.evaluate(state, now);
        long scan = state.incrementScanCounter();
        if (Duration.between(lastScanLogAt, now).compareTo(SCAN_LOG_INTERVAL) >= 0) {
            lastScanLogAt = now;
            log.info("DETECTOR: {} scan #{} | instruments={} activeTrades={} intents={}",
                    strategy.name(), scan, state.trackedInstruments().size(), state.activeTradeCount(), intents.size());
        }

        Map<String, TradeIntent> unique = new LinkedHashMap<>();
        for (TradeIntent intent : intents) {
            unique.putIfAbsent(intent.dedupKey(), intent);
        }
        int accepted = 0;
        for (TradeIntent intent : unique.values()) {
            try {
                dispatch.execute(() -> runIntent(intent));
                accepted++;
            } catch (RejectedExecutionException e) {
                log.warn("DETECTOR: dispatch queue full, dropping {} {} ({})",
                        intent.action(), intent.instrument(), intent.reason());
                metrics.recordIntentDropped();
            }
        }
        return accepted;
    }

    private void runIntent(TradeIntent intent) {
        try {
            executor.execute(intent);
        } catch (RuntimeException e) {
            log.error("DETECTOR: {} {} failed: {}", intent.action(), intent.instrument(), e.toString(), e);
        }
    }

    private ThreadPoolExecutor newDispatchPool() {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(
                config.dispatchThreads(),
                config.dispatchThreads(),
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(config.dispatchQueueSize()),
                r -> {
                    Thread t = new Thread(r, "polyspike-dispatch-" + strategy.name() + "-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
