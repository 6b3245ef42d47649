package com.polyspike.hft.engine.venue;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.state.TradingState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-through access to quotes for strategies and the exit monitor: the ingestor's cache while it is fresh,
 * otherwise a direct venue call whose result refreshes the cache.
 */
@Slf4j
public class QuoteSource {

    private final TradingState state;
    private final VenueGateway gateway;
    private final HftProperties.QuoteCache config;

    public QuoteSource(TradingState state, VenueGateway gateway, HftProperties.QuoteCache config) {
        this.state = Objects.requireNonNull(state, "state");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.config = Objects.requireNonNull(config, "config");
    }

    public Optional<VenueQuote> current(String instrument, Instant now) {
        if (Boolean.TRUE.equals(config.enabled())) {
            Optional<VenueQuote> cached = state.getCachedQuote(instrument, Duration.ofMillis(config.ttlMillis()), now);
            if (cached.isPresent()) {
                return cached;
            }
        }
        QuoteResult result = gateway.getQuote(instrument);
        if (!result.isOk()) {
            log.debug("QUOTES: no quote for {} ({}: {})", instrument, result.status(), result.detail());
            return Optional.empty();
        }
        if (Boolean.TRUE.equals(config.enabled())) {
            state.cacheQuotes(Map.of(instrument, result.quote()));
        }
        return Optional.of(result.quote());
    }
}
