package com.polyspike.hft.engine.signal;

import com.polyspike.hft.engine.state.TradingState;

import java.time.Instant;
import java.util.List;

/**
 * Turns the current state into zero or more intents. Implementations must not call the venue's order path; the
 * detector hands their intents to the order executor.
 */
public interface SignalStrategy {

    String name();

    List<TradeIntent> evaluate(TradingState state, Instant now);

    /**
     * Whether to evaluate on wait timeouts as well as on fresh prices, for strategies with time-based rules.
     */
    default boolean evaluatesOnIdle() {
        return false;
    }
}
