package com.polyspike.hft.engine.signal;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.MutableClock;
import com.polyspike.hft.engine.TestProperties;
import com.polyspike.hft.engine.state.ActiveTrade;
import com.polyspike.hft.engine.state.InstrumentMeta;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.venue.FakeVenueGateway;
import com.polyspike.hft.engine.venue.QuoteSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PairSumArbitrageStrategyTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private TradingState state;
    private FakeVenueGateway venue;
    private PairSumArbitrageStrategy strategy;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        state = new TradingState(10, 3, new BigDecimal("1000"));
        venue = new FakeVenueGateway(clock);
        HftProperties properties = TestProperties.of("hft.engine.pair-arbitrage.enabled=true");
        QuoteSource quotes = new QuoteSource(state, venue, properties.engine().quoteCache());
        strategy = new PairSumArbitrageStrategy(properties.engine(), quotes);
        state.addAssetPair("B-NO", "A-YES");
    }

    @Test
    void cheapPairIsBoughtOnBothLegsOnce() {
        venue.setTopOfBook("A-YES", "0.46", "100", "0.48", "100");
        venue.setTopOfBook("B-NO", "0.48", "100", "0.50", "100");

        List<TradeIntent> intents = strategy.evaluate(state, clock.instant());

        assertThat(intents).extracting(TradeIntent::instrument).containsExactly("A-YES", "B-NO");
        assertThat(intents).allSatisfy(intent -> {
            assertThat(intent.action()).isEqualTo(TradeIntent.Action.BUY);
            assertThat(intent.reason()).contains("0.98");
        });
    }

    @Test
    void fairlyPricedPairIsLeftAlone() {
        venue.setTopOfBook("A-YES", "0.48", "100", "0.50", "100");
        venue.setTopOfBook("B-NO", "0.48", "100", "0.50", "100");

        assertThat(strategy.evaluate(state, clock.instant())).isEmpty();
    }

    @Test
    void entryNeedsTwoFreeSlots() {
        venue.setTopOfBook("A-YES", "0.46", "100", "0.48", "100");
        venue.setTopOfBook("B-NO", "0.48", "100", "0.50", "100");
        state.tryReserveTradeSlot();
        state.tryReserveTradeSlot();

        assertThat(strategy.evaluate(state, clock.instant())).isEmpty();
    }

    @Test
    void heldPairIsSoldWhenBidsBeatEntryCost() {
        holding("A-YES", "0.48");
        holding("B-NO", "0.50");
        venue.setTopOfBook("A-YES", "0.50", "100", "0.52", "100");
        venue.setTopOfBook("B-NO", "0.49", "100", "0.51", "100");

        List<TradeIntent> intents = strategy.evaluate(state, clock.instant());

        assertThat(intents).extracting(TradeIntent::action)
                .containsExactly(TradeIntent.Action.SELL, TradeIntent.Action.SELL);
    }

    @Test
    void heldPairStaysWhileBidsAreBelowEntryCost() {
        holding("A-YES", "0.48");
        holding("B-NO", "0.50");
        venue.setTopOfBook("A-YES", "0.47", "100", "0.49", "100");
        venue.setTopOfBook("B-NO", "0.49", "100", "0.51", "100");

        assertThat(strategy.evaluate(state, clock.instant())).isEmpty();
    }

    @Test
    void positionsTakePrecedenceOverTradesForEntryCost() {
        state.upsertSimulatedPosition("A-YES", BigDecimal.TEN, new BigDecimal("0.40"), new InstrumentMeta("ev", "Yes"));
        state.upsertSimulatedPosition("B-NO", BigDecimal.TEN, new BigDecimal("0.50"), new InstrumentMeta("ev", "No"));
        holding("A-YES", "0.60");
        venue.setTopOfBook("A-YES", "0.45", "100", "0.47", "100");
        venue.setTopOfBook("B-NO", "0.50", "100", "0.52", "100");

        assertThat(strategy.evaluate(state, clock.instant())).hasSize(2);
    }

    @Test
    void oneLeggedHoldingIsNeitherEnteredNorExited() {
        holding("A-YES", "0.48");
        venue.setTopOfBook("A-YES", "0.46", "100", "0.48", "100");
        venue.setTopOfBook("B-NO", "0.48", "100", "0.50", "100");

        assertThat(strategy.evaluate(state, clock.instant())).isEmpty();
    }

    private void holding(String instrument, String entry) {
        BigDecimal price = new BigDecimal(entry);
        state.addActiveTrade(new ActiveTrade(instrument, price, T0, price.multiply(BigDecimal.TEN), BigDecimal.TEN, true));
    }
}
