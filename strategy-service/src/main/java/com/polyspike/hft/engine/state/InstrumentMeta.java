package com.polyspike.hft.engine.state;

/**
 * Descriptive metadata of a tracked instrument. Has no effect on trading decisions.
 */
public record InstrumentMeta(String eventSlug, String outcome) {

    public static final InstrumentMeta UNKNOWN = new InstrumentMeta("", "");

    public InstrumentMeta {
        eventSlug = eventSlug == null ? "" : eventSlug.trim();
        outcome = outcome == null ? "" : outcome.trim();
    }
}
