package com.polyspike.hft.engine.signal;

import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.engine.TestProperties;
import com.polyspike.hft.engine.state.ActiveTrade;
import com.polyspike.hft.engine.state.PricePoint;
import com.polyspike.hft.engine.state.TradingState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MeanReversionStrategyTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private TradingState state;
    private MeanReversionStrategy strategy;

    @BeforeEach
    void setUp() {
        state = new TradingState(20, 3, new BigDecimal("1000"));
        strategy = new MeanReversionStrategy(TestProperties.of(
                "hft.engine.mean-reversion.enabled=true",
                "hft.engine.mean-reversion.lookback=5").engine());
        state.registerInstrument("A", null);
    }

    @Test
    void zScoreOfLatestAgainstWindow() {
        double z = MeanReversionStrategy.zScore(points("0.50", "0.50", "0.50", "0.50", "0.30"), 5).orElseThrow();

        assertThat(z).isCloseTo(-2.0, within(1e-9));
    }

    @Test
    void zScoreNeedsThreePointsAndDispersion() {
        assertThat(MeanReversionStrategy.zScore(points("0.5", "0.4"), 5)).isEmpty();
        assertThat(MeanReversionStrategy.zScore(points("0.5", "0.5", "0.5", "0.5"), 5)).isEmpty();
    }

    @Test
    void deepDipBuys() {
        prices("0.50", "0.50", "0.50", "0.50", "0.30");

        List<TradeIntent> intents = strategy.evaluate(state, T0.plusSeconds(10));

        assertThat(intents).singleElement().satisfies(intent -> {
            assertThat(intent.action()).isEqualTo(TradeIntent.Action.BUY);
            assertThat(intent.reason()).startsWith("mean reversion entry z=-2.00");
        });
    }

    @Test
    void dipDuringCooldownIsIgnored() {
        prices("0.50", "0.50", "0.50", "0.50", "0.30");
        state.markRecentTrade("A", OrderSide.BUY, T0);

        assertThat(strategy.evaluate(state, T0.plusSeconds(10))).isEmpty();
    }

    @Test
    void revertedPriceExitsOpenTrade() {
        prices("0.50", "0.40", "0.50", "0.40", "0.45");
        state.addActiveTrade(new ActiveTrade("A", new BigDecimal("0.40"), T0, new BigDecimal("4"), BigDecimal.TEN, true));

        List<TradeIntent> intents = strategy.evaluate(state, T0.plusSeconds(10));

        assertThat(intents).singleElement().satisfies(intent -> {
            assertThat(intent.action()).isEqualTo(TradeIntent.Action.SELL);
            assertThat(intent.reason()).startsWith("mean reversion exit");
        });
    }

    @Test
    void overstayedTradeExitsRegardlessOfPrice() {
        prices("0.50", "0.50", "0.50", "0.50", "0.30");
        state.addActiveTrade(new ActiveTrade("A", new BigDecimal("0.30"), T0.minusSeconds(601),
                new BigDecimal("3"), BigDecimal.TEN, true));

        assertThat(strategy.evaluate(state, T0))
                .extracting(TradeIntent::reason)
                .containsExactly("mean reversion max hold");
    }

    @Test
    void openTradeStillFarFromMeanIsHeld() {
        prices("0.50", "0.50", "0.50", "0.50", "0.30");
        state.addActiveTrade(new ActiveTrade("A", new BigDecimal("0.30"), T0, new BigDecimal("3"), BigDecimal.TEN, true));

        assertThat(strategy.evaluate(state, T0.plusSeconds(10))).isEmpty();
        assertThat(strategy.evaluatesOnIdle()).isTrue();
    }

    private void prices(String... values) {
        for (int i = 0; i < values.length; i++) {
            state.addPrice("A", T0.plusSeconds(i), new BigDecimal(values[i]), "", "");
        }
    }

    private static List<PricePoint> points(String... values) {
        List<PricePoint> out = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            out.add(new PricePoint(T0.plusSeconds(i), new BigDecimal(values[i]), "", ""));
        }
        return out;
    }
}
