package com.polyspike.hft.engine.signal;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.MutableClock;
import com.polyspike.hft.engine.TestProperties;
import com.polyspike.hft.engine.execution.OrderExecutor;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.metrics.PolyspikeMetrics;
import com.polyspike.hft.strategy.metrics.StrategyMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalDetectorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private TradingState state;
    private OrderExecutor executor;
    private SimpleMeterRegistry registry;
    private StrategyMetricsService metrics;
    private HftProperties.Detector config;

    @BeforeEach
    void setUp() {
        state = new TradingState(10, 3, new BigDecimal("1000"));
        executor = mock(OrderExecutor.class);
        registry = new SimpleMeterRegistry();
        metrics = new StrategyMetricsService(new PolyspikeMetrics(registry));
        metrics.initializeMetrics();
        config = TestProperties.of("hft.engine.detector.wait-timeout-millis=20").engine().detector();
    }

    @Test
    void duplicateIntentsInOneScanAreDispatchedOnce() {
        SignalDetector detector = detector(fixed(
                TradeIntent.buy("A", "first", "test"),
                TradeIntent.buy("A", "second", "test"),
                TradeIntent.sell("A", "exit", "test"),
                TradeIntent.buy("B", "other", "test")));

        int accepted = detector.scanOnce(Runnable::run);

        assertThat(accepted).isEqualTo(3);
        verify(executor, times(3)).execute(any());
        assertThat(state.statusSnapshot().scans()).isEqualTo(1);
    }

    @Test
    void fullDispatchQueueDropsAndCountsIntents() {
        SignalDetector detector = detector(fixed(
                TradeIntent.buy("A", "r", "test"),
                TradeIntent.buy("B", "r", "test")));

        int accepted = detector.scanOnce(task -> {
            throw new RejectedExecutionException("queue full");
        });

        assertThat(accepted).isZero();
        verify(executor, never()).execute(any());
        assertThat(registry.get("polyspike_engine_intents_dropped_total").counter().count()).isEqualTo(2.0);
    }

    @Test
    void failingIntentDoesNotBreakTheScan() {
        when(executor.execute(any())).thenThrow(new IllegalStateException("boom")).thenReturn(true);
        SignalDetector detector = detector(fixed(
                TradeIntent.buy("A", "r", "test"),
                TradeIntent.buy("B", "r", "test")));

        assertThat(detector.scanOnce(Runnable::run)).isEqualTo(2);
        verify(executor, times(2)).execute(any());
    }

    @Test
    void runScansOnPriceUpdateAndStopsOnShutdown() throws Exception {
        SignalDetector detector = detector(fixed(TradeIntent.buy("A", "r", "test")));
        Thread worker = new Thread(() -> {
            try {
                detector.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        worker.start();

        state.signalPriceUpdate();
        verify(executor, timeout(2_000)).execute(any());

        state.requestShutdown();
        worker.join(TimeUnit.SECONDS.toMillis(5));
        assertThat(worker.isAlive()).isFalse();
        assertThat(detector.name()).isEqualTo("detector-fixed");
    }

    @Test
    void idleStrategyIsNotScannedWithoutUpdates() throws Exception {
        SignalDetector detector = detector(fixed(TradeIntent.buy("A", "r", "test")));
        Thread worker = new Thread(() -> {
            try {
                detector.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        worker.start();

        state.awaitShutdown(Duration.ofMillis(150));
        state.requestShutdown();
        worker.join(TimeUnit.SECONDS.toMillis(5));

        verify(executor, never()).execute(any());
    }

    private SignalDetector detector(SignalStrategy strategy) {
        return new SignalDetector(strategy, state, executor, config, new MutableClock(T0), metrics);
    }

    private static SignalStrategy fixed(TradeIntent... intents) {
        return new SignalStrategy() {
            @Override
            public String name() {
                return "fixed";
            }

            @Override
            public List<TradeIntent> evaluate(TradingState state, Instant now) {
                return List.of(intents);
            }
        };
    }
}
