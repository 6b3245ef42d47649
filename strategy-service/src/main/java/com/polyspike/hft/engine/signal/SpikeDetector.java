package com.polyspike.hft.engine.signal;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.state.PricePoint;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detects abrupt relative moves in a price history. Stateless; safe to share between threads.
 */
public class SpikeDetector {

    private final HftProperties.Spike config;

    public SpikeDetector(HftProperties.Spike config) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.priceLowerBound().compareTo(config.priceUpperBound()) >= 0) {
            throw new IllegalStateException("hft.engine.spike.price-lower-bound (" + config.priceLowerBound()
                    + ") must be below price-upper-bound (" + config.priceUpperBound() + ")");
        }
    }

    /**
     * @param history oldest first
     * @param spread  current bid/ask spread, or null when unknown
     */
    public Optional<Spike> detect(List<PricePoint> history, Instant now, BigDecimal spread) {
        if (history == null || history.size() < 2) {
            return Optional.empty();
        }
        PricePoint last = history.get(history.size() - 1);
        long maxAge = config.maxDataAgeMillis();
        if (maxAge > 0 && Duration.between(last.timestamp(), now).toMillis() > maxAge) {
            return Optional.empty();
        }
        Optional<PricePoint> reference = reference(history);
        if (reference.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal ref = reference.get().price();
        BigDecimal current = last.price();
        if (ref.signum() <= 0 || current.signum() <= 0) {
            return Optional.empty();
        }

        double delta = current.subtract(ref).divide(ref, MathContext.DECIMAL64).doubleValue();
        double threshold = threshold(delta, history, spread);
        if (Math.abs(delta) <= threshold) {
            return Optional.empty();
        }
        if (current.compareTo(config.priceLowerBound()) < 0 || current.compareTo(config.priceUpperBound()) > 0) {
            return Optional.empty();
        }
        return Optional.of(new Spike(delta, threshold, ref, current));
    }

    private Optional<PricePoint> reference(List<PricePoint> history) {
        int n = history.size();
        return switch (config.lookbackMode()) {
            case PREVIOUS_TICK -> Optional.of(history.get(n - 2));
            case SAMPLE_COUNT -> {
                int samples = config.lookbackSamples();
                int count = samples <= 0 ? n : Math.max(2, Math.min(n, samples));
                yield Optional.of(history.get(n - count));
            }
            case TIME_SPAN -> firstWithinSpan(history);
        };
    }

    /**
     * Empty when only the latest point falls inside the span.
     */
    private Optional<PricePoint> firstWithinSpan(List<PricePoint> history) {
        int n = history.size();
        Instant cutoff = history.get(n - 1).timestamp().minusMillis(config.lookbackMillis());
        for (int i = 0; i < n - 1; i++) {
            if (!history.get(i).timestamp().isBefore(cutoff)) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }

    double threshold(double delta, List<PricePoint> history, BigDecimal spread) {
        double base = delta >= 0 ? config.thresholdUp() : config.thresholdDown();
        if (!Boolean.TRUE.equals(config.dynamicThresholdEnabled())) {
            return base;
        }
        double threshold = Math.max(base, config.volatilityCoefficient() * returnStdev(history, config.volatilityWindow()));
        if (spread != null) {
            threshold = Math.max(threshold, spread.doubleValue() + config.spreadBuffer());
        }
        return threshold;
    }

    /**
     * Population standard deviation of tick-to-tick returns over the last {@code window} prices.
     */
    static double returnStdev(List<PricePoint> history, int window) {
        int from = Math.max(0, history.size() - window);
        List<Double> returns = new ArrayList<>();
        for (int i = from + 1; i < history.size(); i++) {
            double prev = history.get(i - 1).price().doubleValue();
            if (prev <= 0) {
                continue;
            }
            returns.add((history.get(i).price().doubleValue() - prev) / prev);
        }
        return Stats.populationStdev(returns);
    }

    public record Spike(double delta, double threshold, BigDecimal reference, BigDecimal last) {

        public boolean up() {
            return delta > 0;
        }
    }
}
