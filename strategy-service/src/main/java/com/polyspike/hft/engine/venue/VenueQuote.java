package com.polyspike.hft.engine.venue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Book snapshot for one instrument: bids best (highest) first, asks best (lowest) first. Either side may be empty.
 */
public record VenueQuote(String instrument, List<DepthLevel> bids, List<DepthLevel> asks, Instant fetchedAt) {

    public VenueQuote {
        bids = bids == null ? List.of() : bids.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(DepthLevel::price).reversed())
                .toList();
        asks = asks == null ? List.of() : asks.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(DepthLevel::price))
                .toList();
    }

    public Optional<DepthLevel> bestBid() {
        return bids.stream().findFirst();
    }

    public Optional<DepthLevel> bestAsk() {
        return asks.stream().findFirst();
    }

    public boolean isEmpty() {
        return bids.isEmpty() && asks.isEmpty();
    }

    /**
     * Midpoint when both sides exist, otherwise whichever side is present.
     */
    public Optional<BigDecimal> mid() {
        Optional<BigDecimal> bid = bestBid().map(DepthLevel::price);
        Optional<BigDecimal> ask = bestAsk().map(DepthLevel::price);
        if (bid.isPresent() && ask.isPresent()) {
            return Optional.of(bid.get().add(ask.get()).divide(BigDecimal.valueOf(2), 6, RoundingMode.HALF_UP));
        }
        return bid.isPresent() ? bid : ask;
    }

    public Optional<BigDecimal> spread() {
        if (bestBid().isEmpty() || bestAsk().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(bestAsk().get().price().subtract(bestBid().get().price()));
    }
}
