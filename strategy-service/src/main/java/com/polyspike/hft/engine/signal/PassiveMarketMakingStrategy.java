package com.polyspike.hft.engine.signal;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.engine.state.PositionInfo;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.venue.DepthLevel;
import com.polyspike.hft.engine.venue.QuoteSource;
import com.polyspike.hft.engine.venue.VenueQuote;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rests a bid and an ask around the mid, never inside the current touch.
 */
@Slf4j
public class PassiveMarketMakingStrategy implements SignalStrategy {

    public static final String NAME = "market-making";

    private static final BigDecimal MIN_PRICE = new BigDecimal("0.001");
    private static final BigDecimal MAX_PRICE = new BigDecimal("0.999");
    private static final BigDecimal BPS_TO_HALF_SPREAD = BigDecimal.valueOf(20_000);

    private final HftProperties.MarketMaking config;
    private final QuoteSource quotes;
    private final Map<String, Instant> lastQuoteAt = new ConcurrentHashMap<>();

    public PassiveMarketMakingStrategy(HftProperties.Engine engine, QuoteSource quotes) {
        this.config = engine.marketMaking();
        this.quotes = quotes;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean evaluatesOnIdle() {
        return true;
    }

    @Override
    public List<TradeIntent> evaluate(TradingState state, Instant now) {
        List<TradeIntent> intents = new ArrayList<>();
        Duration refresh = Duration.ofSeconds(config.refreshSeconds());
        for (String instrument : state.trackedInstruments()) {
            Instant last = lastQuoteAt.get(instrument);
            if (last != null && Duration.between(last, now).compareTo(refresh) < 0) {
                continue;
            }
            Optional<VenueQuote> quote = quotes.current(instrument, now);
            if (quote.isEmpty() || quote.get().bestBid().isEmpty() || quote.get().bestAsk().isEmpty()) {
                continue;
            }
            lastQuoteAt.put(instrument, now);
            BigDecimal inventory = state.findPosition(instrument).map(PositionInfo::shares).orElse(BigDecimal.ZERO);
            intents.addAll(quotesFor(instrument, quote.get(), inventory));
        }
        return intents;
    }

    List<TradeIntent> quotesFor(String instrument, VenueQuote quote, BigDecimal inventory) {
        BigDecimal bestBid = quote.bestBid().map(DepthLevel::price).orElseThrow();
        BigDecimal bestAsk = quote.bestAsk().map(DepthLevel::price).orElseThrow();
        BigDecimal mid = bestBid.add(bestAsk).divide(BigDecimal.valueOf(2), 6, RoundingMode.HALF_UP);
        BigDecimal half = mid.multiply(BigDecimal.valueOf(config.spreadBps()))
                .divide(BPS_TO_HALF_SPREAD, 6, RoundingMode.HALF_UP);

        BigDecimal bid = MIN_PRICE.max(bestBid.min(mid.subtract(half))).setScale(3, RoundingMode.HALF_UP);
        BigDecimal ask = MAX_PRICE.min(bestAsk.max(mid.add(half))).setScale(3, RoundingMode.HALF_UP);

        List<TradeIntent> out = new ArrayList<>(2);
        if (inventory.compareTo(config.maxInventory()) < 0) {
            out.add(TradeIntent.quote(instrument, OrderSide.BUY, bid, config.orderSize(), NAME));
        } else {
            log.debug("STRATEGY: {} inventory {} at cap, no bid", instrument, inventory);
        }
        if (inventory.signum() > 0) {
            out.add(TradeIntent.quote(instrument, OrderSide.SELL, ask, config.orderSize().min(inventory), NAME));
        }
        return out;
    }
}
