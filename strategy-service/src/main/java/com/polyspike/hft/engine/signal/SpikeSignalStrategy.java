package com.polyspike.hft.engine.signal;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.engine.state.PricePoint;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.venue.VenueQuote;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Buys into an upward spike, or buys the paired instrument on a downward one.
 */
@Slf4j
public class SpikeSignalStrategy implements SignalStrategy {

    public static final String NAME = "spike";

    private final SpikeDetector detector;
    private final Duration cooldown;
    private final Duration quoteTtl;

    public SpikeSignalStrategy(HftProperties.Engine engine) {
        this.detector = new SpikeDetector(engine.spike());
        this.cooldown = Duration.ofSeconds(engine.trading().cooldownSeconds());
        this.quoteTtl = Duration.ofMillis(engine.quoteCache().ttlMillis());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<TradeIntent> evaluate(TradingState state, Instant now) {
        List<TradeIntent> intents = new ArrayList<>();
        for (String instrument : state.trackedInstruments()) {
            List<PricePoint> history = state.getPriceHistory(instrument);
            BigDecimal spread = state.getCachedQuote(instrument, quoteTtl, now)
                    .flatMap(VenueQuote::spread)
                    .orElse(null);
            Optional<SpikeDetector.Spike> spike = detector.detect(history, now, spread);
            if (spike.isEmpty()) {
                continue;
            }
            SpikeDetector.Spike s = spike.get();
            String target = instrument;
            if (!s.up()) {
                Optional<String> pair = state.getAssetPair(instrument);
                if (pair.isEmpty()) {
                    log.info("SPIKE: {} fell {} but has no paired instrument, skipping", instrument, percent(s.delta()));
                    continue;
                }
                target = pair.get();
            }
            if (state.isWithinCooldown(target, OrderSide.BUY, now, cooldown)) {
                log.debug("SPIKE: {} in buy cooldown, ignoring spike on {}", target, instrument);
                continue;
            }
            String reason = String.format(Locale.ROOT, "spike %s on %s (threshold %s, %s -> %s)",
                    percent(s.delta()), instrument, percent(s.threshold()), s.reference(), s.last());
            log.info("SPIKE: {} -> BUY {}", reason, target);
            intents.add(TradeIntent.buy(target, reason, NAME));
        }
        return intents;
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%+.2f%%", value * 100.0);
    }
}
