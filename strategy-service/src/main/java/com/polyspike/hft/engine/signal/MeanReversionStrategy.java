package com.polyspike.hft.engine.signal;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.engine.state.ActiveTrade;
import com.polyspike.hft.engine.state.PricePoint;
import com.polyspike.hft.engine.state.TradingState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Buys when the latest price sits far below its rolling mean and exits once it has reverted or the hold is too long.
 */
@Slf4j
public class MeanReversionStrategy implements SignalStrategy {

    public static final String NAME = "mean-reversion";

    private final HftProperties.MeanReversion config;
    private final Duration cooldown;

    public MeanReversionStrategy(HftProperties.Engine engine) {
        this.config = engine.meanReversion();
        this.cooldown = Duration.ofSeconds(engine.trading().cooldownSeconds());
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
        Map<String, ActiveTrade> trades = state.getActiveTrades();
        Duration maxHold = Duration.ofSeconds(config.maxHoldSeconds());

        for (String instrument : state.trackedInstruments()) {
            OptionalDouble z = zScore(state.getPriceHistory(instrument), config.lookback());
            ActiveTrade open = trades.get(instrument);

            if (open != null) {
                if (Duration.between(open.entryTime(), now).compareTo(maxHold) > 0) {
                    intents.add(TradeIntent.sell(instrument, "mean reversion max hold", NAME));
                } else if (z.isPresent() && Math.abs(z.getAsDouble()) <= config.exitZ()) {
                    intents.add(TradeIntent.sell(instrument,
                            String.format(Locale.ROOT, "mean reversion exit z=%.2f", z.getAsDouble()), NAME));
                }
                continue;
            }

            if (z.isEmpty() || z.getAsDouble() > -config.entryZ()) {
                continue;
            }
            if (state.isWithinCooldown(instrument, OrderSide.BUY, now, cooldown)) {
                log.debug("STRATEGY: {} z={} but in buy cooldown", instrument, z.getAsDouble());
                continue;
            }
            intents.add(TradeIntent.buy(instrument,
                    String.format(Locale.ROOT, "mean reversion entry z=%.2f", z.getAsDouble()), NAME));
        }
        return intents;
    }

    /**
     * z-score of the latest price against the last {@code lookback} points. Empty below three points or with no
     * dispersion.
     */
    static OptionalDouble zScore(List<PricePoint> history, int lookback) {
        int from = Math.max(0, history.size() - lookback);
        List<Double> window = new ArrayList<>();
        for (int i = from; i < history.size(); i++) {
            window.add(history.get(i).price().doubleValue());
        }
        if (window.size() < 3) {
            return OptionalDouble.empty();
        }
        double sigma = Stats.populationStdev(window);
        if (sigma == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((window.get(window.size() - 1) - Stats.mean(window)) / sigma);
    }
}
