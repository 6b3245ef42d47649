package com.polyspike.hft.engine.exit;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.MutableClock;
import com.polyspike.hft.engine.TestProperties;
import com.polyspike.hft.engine.execution.OrderExecutor;
import com.polyspike.hft.engine.state.ActiveTrade;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.venue.FakeVenueGateway;
import com.polyspike.hft.engine.venue.QuoteSource;
import com.polyspike.hft.events.NoopHftEventPublisher;
import com.polyspike.hft.metrics.PolyspikeMetrics;
import com.polyspike.hft.strategy.metrics.StrategyMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExitMonitorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private TradingState state;
    private FakeVenueGateway venue;
    private HftProperties properties;
    private ExitMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        state = new TradingState(10, 3, new BigDecimal("1000"));
        venue = new FakeVenueGateway(clock);
        properties = TestProperties.of(
                "hft.engine.exit.holding-time-limit-seconds=3600",
                "hft.engine.exit.take-profit-usd=5",
                "hft.engine.exit.take-profit-pct=0.5",
                "hft.engine.exit.stop-loss-usd=5",
                "hft.engine.exit.stop-loss-pct=0.5");
        StrategyMetricsService metrics = new StrategyMetricsService(new PolyspikeMetrics(new SimpleMeterRegistry()));
        metrics.initializeMetrics();
        OrderExecutor executor = new OrderExecutor(state, venue, properties, clock, new NoopHftEventPublisher(), metrics);
        QuoteSource quotes = new QuoteSource(state, venue, properties.engine().quoteCache());
        monitor = new ExitMonitor(state, quotes, executor, properties.engine().exit(), clock);
    }

    @Test
    void profitableTradeIsClosedOnTakeProfit() {
        openTrade("A", "0.40", "100", T0);
        state.tryReserveTradeSlot();
        venue.setTopOfBook("A", "0.50", "200", "0.52", "200");
        clock.advance(Duration.ofSeconds(30));

        List<ExitMonitor.ExitDecision> decisions = monitor.checkOnce(clock.instant());

        assertThat(decisions).singleElement().satisfies(d -> {
            assertThat(d.reason()).isEqualTo(ExitMonitor.TAKE_PROFIT);
            assertThat(d.cashPnl()).isEqualByComparingTo("10");
            assertThat(d.pctPnl()).isCloseTo(0.25, within(1e-9));
            assertThat(d.executed()).isTrue();
        });
        assertThat(state.getActiveTrades()).isEmpty();
        assertThat(state.reservedTradeSlots()).isZero();
        assertThat(state.lastTradeClosedAt()).contains(clock.instant());
    }

    @Test
    void losingTradeIsClosedOnStopLoss() {
        openTrade("A", "0.40", "100", T0);
        venue.setTopOfBook("A", "0.34", "200", "0.36", "200");

        assertThat(monitor.checkOnce(T0.plusSeconds(5)))
                .extracting(ExitMonitor.ExitDecision::reason)
                .containsExactly(ExitMonitor.STOP_LOSS);
    }

    @Test
    void percentageRuleFiresForSmallPositions() {
        openTrade("A", "0.20", "5", T0);
        venue.setTopOfBook("A", "0.31", "200", "0.33", "200");

        assertThat(monitor.checkOnce(T0.plusSeconds(5)))
                .extracting(ExitMonitor.ExitDecision::reason)
                .containsExactly(ExitMonitor.TAKE_PROFIT);
    }

    @Test
    void holdingTimeWinsOverProfit() {
        openTrade("A", "0.40", "100", T0);
        venue.setTopOfBook("A", "0.50", "200", "0.52", "200");

        ExitMonitor.ExitDecision decision = monitor.evaluate(
                state.getActiveTrade("A").orElseThrow(), T0.plusSeconds(3601)).orElseThrow();

        assertThat(decision.reason()).isEqualTo(ExitMonitor.HOLDING_TIME);
    }

    @Test
    void flatTradeIsKept() {
        openTrade("A", "0.40", "100", T0);
        venue.setTopOfBook("A", "0.41", "200", "0.43", "200");

        assertThat(monitor.checkOnce(T0.plusSeconds(60))).isEmpty();
        assertThat(state.getActiveTrade("A")).isPresent();
    }

    @Test
    void tradeWithoutBidIsSkipped() {
        openTrade("A", "0.40", "100", T0);

        assertThat(monitor.checkOnce(T0.plusSeconds(3601))).isEmpty();
        assertThat(state.getActiveTrade("A")).isPresent();
    }

    @Test
    void failedSellLeavesTradeForNextCycle() {
        OrderExecutor executor = mock(OrderExecutor.class);
        when(executor.placeSell(anyString(), anyString())).thenReturn(false);
        ExitMonitor withFailingSells = new ExitMonitor(state, new QuoteSource(state, venue, properties.engine().quoteCache()),
                executor, properties.engine().exit(), clock);
        openTrade("A", "0.40", "100", T0);
        venue.setTopOfBook("A", "0.50", "200", "0.52", "200");

        List<ExitMonitor.ExitDecision> decisions = withFailingSells.checkOnce(T0.plusSeconds(1));

        assertThat(decisions).singleElement().satisfies(d -> assertThat(d.executed()).isFalse());
        assertThat(state.getActiveTrade("A")).isPresent();
        verify(executor).placeSell("A", ExitMonitor.TAKE_PROFIT);
    }

    @Test
    void nothingIsEvaluatedAfterShutdown() {
        OrderExecutor executor = mock(OrderExecutor.class);
        ExitMonitor idle = new ExitMonitor(state, new QuoteSource(state, venue, properties.engine().quoteCache()),
                executor, properties.engine().exit(), clock);
        openTrade("A", "0.40", "100", T0);
        venue.setTopOfBook("A", "0.50", "200", "0.52", "200");
        state.requestShutdown();

        assertThat(idle.checkOnce(T0.plusSeconds(1))).isEmpty();
        verify(executor, never()).placeSell(anyString(), anyString());
    }

    private void openTrade(String instrument, String entry, String shares, Instant at) {
        BigDecimal price = new BigDecimal(entry);
        BigDecimal qty = new BigDecimal(shares);
        state.addActiveTrade(new ActiveTrade(instrument, price, at, price.multiply(qty), qty, true));
    }
}
