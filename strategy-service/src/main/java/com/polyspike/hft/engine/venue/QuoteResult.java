package com.polyspike.hft.engine.venue;

import java.util.Optional;

/**
 * Outcome of a quote request. Only {@link Status#TRANSIENT} is worth retrying.
 */
public record QuoteResult(Status status, VenueQuote quote, String detail) {

    public enum Status {
        OK,
        NO_LIQUIDITY,
        TRANSIENT,
        INVALID,
    }

    public static QuoteResult ok(VenueQuote quote) {
        return new QuoteResult(Status.OK, quote, null);
    }

    public static QuoteResult noLiquidity(String detail) {
        return new QuoteResult(Status.NO_LIQUIDITY, null, detail);
    }

    public static QuoteResult transientFailure(String detail) {
        return new QuoteResult(Status.TRANSIENT, null, detail);
    }

    public static QuoteResult invalid(String detail) {
        return new QuoteResult(Status.INVALID, null, detail);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Optional<VenueQuote> quoteIfOk() {
        return isOk() ? Optional.ofNullable(quote) : Optional.empty();
    }
}
