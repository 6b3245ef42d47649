package com.polyspike.hft.engine.signal;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.engine.state.ActiveTrade;
import com.polyspike.hft.engine.state.PositionInfo;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.venue.DepthLevel;
import com.polyspike.hft.engine.venue.QuoteSource;
import com.polyspike.hft.engine.venue.VenueQuote;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Complementary outcomes settle to 1 together. Buys both legs when their asks sum below the entry threshold and
 * sells both once their bids pay back the combined entry cost plus an edge.
 */
@Slf4j
public class PairSumArbitrageStrategy implements SignalStrategy {

    public static final String NAME = "pair-arbitrage";

    private final HftProperties.PairArbitrage config;
    private final QuoteSource quotes;
    private final Duration cooldown;

    public PairSumArbitrageStrategy(HftProperties.Engine engine, QuoteSource quotes) {
        this.config = engine.pairArbitrage();
        this.quotes = quotes;
        this.cooldown = Duration.ofSeconds(engine.trading().cooldownSeconds());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<TradeIntent> evaluate(TradingState state, Instant now) {
        List<TradeIntent> intents = new ArrayList<>();
        for (String a : state.trackedInstruments()) {
            Optional<String> paired = state.getAssetPair(a);
            if (paired.isEmpty() || a.compareTo(paired.get()) > 0) {
                continue;
            }
            String b = paired.get();
            Optional<BigDecimal> entryA = entryPrice(state, a);
            Optional<BigDecimal> entryB = entryPrice(state, b);

            if (entryA.isPresent() && entryB.isPresent()) {
                checkExit(a, b, entryA.get().add(entryB.get()), now, intents);
            } else if (entryA.isEmpty() && entryB.isEmpty()) {
                checkEntry(state, a, b, now, intents);
            }
        }
        return intents;
    }

    private void checkEntry(TradingState state, String a, String b, Instant now, List<TradeIntent> intents) {
        if (state.availableTradeSlots() < 2) {
            return;
        }
        if (state.isWithinCooldown(a, OrderSide.BUY, now, cooldown) || state.isWithinCooldown(b, OrderSide.BUY, now, cooldown)) {
            return;
        }
        Optional<BigDecimal> askA = quotes.current(a, now).flatMap(VenueQuote::bestAsk).map(DepthLevel::price);
        Optional<BigDecimal> askB = quotes.current(b, now).flatMap(VenueQuote::bestAsk).map(DepthLevel::price);
        if (askA.isEmpty() || askB.isEmpty()) {
            return;
        }
        BigDecimal sum = askA.get().add(askB.get());
        if (sum.compareTo(config.entrySumThreshold()) < 0) {
            String reason = "pair ask sum " + sum + " < " + config.entrySumThreshold();
            log.info("STRATEGY: {} for {} / {}", reason, a, b);
            intents.add(TradeIntent.buy(a, reason, NAME));
            intents.add(TradeIntent.buy(b, reason, NAME));
        }
    }

    private void checkExit(String a, String b, BigDecimal entryCost, Instant now, List<TradeIntent> intents) {
        Optional<BigDecimal> bidA = quotes.current(a, now).flatMap(VenueQuote::bestBid).map(DepthLevel::price);
        Optional<BigDecimal> bidB = quotes.current(b, now).flatMap(VenueQuote::bestBid).map(DepthLevel::price);
        if (bidA.isEmpty() || bidB.isEmpty()) {
            return;
        }
        BigDecimal sum = bidA.get().add(bidB.get());
        if (sum.compareTo(entryCost.add(config.exitMinEdge())) > 0) {
            String reason = "pair bid sum " + sum + " > entry " + entryCost;
            log.info("STRATEGY: {} for {} / {}", reason, a, b);
            intents.add(TradeIntent.sell(a, reason, NAME));
            intents.add(TradeIntent.sell(b, reason, NAME));
        }
    }

    private static Optional<BigDecimal> entryPrice(TradingState state, String instrument) {
        Optional<PositionInfo> position = state.findPosition(instrument).filter(p -> p.shares().signum() > 0);
        if (position.isPresent()) {
            return Optional.of(position.get().avgPrice());
        }
        return state.getActiveTrade(instrument).map(ActiveTrade::entryPrice);
    }
}
