package com.polyspike.hft.engine.venue;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * The matching venue as seen by the engine. Implementations never throw for venue failures; they classify them.
 */
public interface VenueGateway {

    QuoteResult getQuote(String instrument);

    /**
     * Batched quotes. The map holds only the instruments the batched call answered with a usable book; callers fall
     * back to {@link #getQuote(String)} for the rest.
     */
    Map<String, QuoteResult> getQuotes(Collection<String> instruments);

    OrderAck submitOrder(VenueOrder order);

    /**
     * Available USDC, or empty when the balance cannot be read right now.
     */
    Optional<BigDecimal> getBalance();
}
