package com.polyspike.hft.engine.venue;

import java.math.BigDecimal;

/**
 * Venue acknowledgment of an order.
 * <p>
 * {@code TRANSIENT} means the venue refused before processing (rate limit, unavailable) and the order may be resent.
 * {@code UNKNOWN} means the request may have reached the book; it is never treated as filled and never resent blindly.
 */
public record OrderAck(Outcome outcome, BigDecimal filledAmount, String orderId, String detail) {

    public enum Outcome {
        FILLED,
        /**
         * Resting limit order accepted onto the book.
         */
        ACCEPTED,
        REJECTED,
        TRANSIENT,
        UNKNOWN,
    }

    public static OrderAck filled(BigDecimal filledAmount, String orderId) {
        return new OrderAck(Outcome.FILLED, filledAmount, orderId, null);
    }

    public static OrderAck accepted(String orderId) {
        return new OrderAck(Outcome.ACCEPTED, BigDecimal.ZERO, orderId, null);
    }

    public static OrderAck rejected(String detail) {
        return new OrderAck(Outcome.REJECTED, BigDecimal.ZERO, null, detail);
    }

    public static OrderAck transientFailure(String detail) {
        return new OrderAck(Outcome.TRANSIENT, BigDecimal.ZERO, null, detail);
    }

    public static OrderAck unknown(String detail) {
        return new OrderAck(Outcome.UNKNOWN, BigDecimal.ZERO, null, detail);
    }

    public boolean isFilled() {
        return outcome == Outcome.FILLED && filledAmount != null && filledAmount.signum() > 0;
    }
}
