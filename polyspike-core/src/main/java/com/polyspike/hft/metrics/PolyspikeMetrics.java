package com.polyspike.hft.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Thin helpers over the Micrometer registry shared by polyspike services.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PolyspikeMetrics {

    private final MeterRegistry registry;

    /**
     * Gauge over an integer supplier, read on every scrape.
     */
    public void registerIntGauge(String name, String description, Supplier<Integer> valueSupplier, Tag... tags) {
        Gauge.builder(name, valueSupplier, supplier -> {
            Integer value = supplier.get();
            return value != null ? value.doubleValue() : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .register(registry);
        log.debug("Registered gauge: {} with description: {}", name, description);
    }

    /**
     * Gauge over a boolean supplier (1 = true, 0 = false).
     */
    public void registerBooleanGauge(String name, String description, Supplier<Boolean> valueSupplier, Tag... tags) {
        Gauge.builder(name, valueSupplier, supplier -> Boolean.TRUE.equals(supplier.get()) ? 1.0 : 0.0)
                .description(description)
                .tags(List.of(tags))
                .register(registry);
        log.debug("Registered boolean gauge: {} with description: {}", name, description);
    }

    /**
     * Gauge backed by a mutable reference; callers update the returned reference.
     */
    public AtomicReference<BigDecimal> registerAtomicBigDecimalGauge(String name, String description, BigDecimal initialValue, Tag... tags) {
        AtomicReference<BigDecimal> ref = new AtomicReference<>(initialValue != null ? initialValue : BigDecimal.ZERO);
        Gauge.builder(name, ref, atomicRef -> {
            BigDecimal value = atomicRef.get();
            return value != null ? value.doubleValue() : 0.0;
        })
                .description(description)
                .tags(List.of(tags))
                .register(registry);
        log.debug("Registered atomic gauge: {} with description: {}", name, description);
        return ref;
    }

    public Counter createCounter(String name, String description, Tag... tags) {
        Counter counter = Counter.builder(name)
                .description(description)
                .tags(List.of(tags))
                .register(registry);
        log.debug("Created counter: {} with description: {}", name, description);
        return counter;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
