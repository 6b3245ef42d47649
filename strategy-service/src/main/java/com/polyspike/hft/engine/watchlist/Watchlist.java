package com.polyspike.hft.engine.watchlist;

import com.polyspike.hft.engine.state.InstrumentMeta;
import com.polyspike.hft.engine.state.TradingState;

import java.util.ArrayList;
import java.util.List;

/**
 * Instruments the engine tracks: complementary pairs plus unpaired singles.
 */
public record Watchlist(List<Pair> pairs, List<Single> singles) {

    public static final Watchlist EMPTY = new Watchlist(List.of(), List.of());

    public Watchlist {
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
        singles = singles == null ? List.of() : List.copyOf(singles);
    }

    public boolean isEmpty() {
        return pairs.isEmpty() && singles.isEmpty();
    }

    public int instrumentCount() {
        return pairs.size() * 2 + singles.size();
    }

    public Watchlist merge(Watchlist other) {
        List<Pair> p = new ArrayList<>(pairs);
        p.addAll(other.pairs());
        List<Single> s = new ArrayList<>(singles);
        s.addAll(other.singles());
        return new Watchlist(p, s);
    }

    /**
     * Registers every instrument and pair. Conflicting pairs are refused by the state and logged there.
     */
    public void apply(TradingState state) {
        for (Pair pair : pairs) {
            state.registerInstrument(pair.first(), pair.firstMeta());
            state.registerInstrument(pair.second(), pair.secondMeta());
            state.addAssetPair(pair.first(), pair.second());
        }
        for (Single single : singles) {
            state.registerInstrument(single.instrument(), single.meta());
        }
    }

    public record Pair(String first, InstrumentMeta firstMeta, String second, InstrumentMeta secondMeta) {
    }

    public record Single(String instrument, InstrumentMeta meta) {
    }
}
