package com.polyspike.hft.engine.ingest;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.state.InstrumentMeta;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.supervisor.SupervisedTask;
import com.polyspike.hft.engine.venue.QuoteResult;
import com.polyspike.hft.engine.venue.VenueGateway;
import com.polyspike.hft.engine.venue.VenueQuote;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls quotes for tracked instruments in round-robin batches and appends their mids to the price history.
 */
@Slf4j
public class PriceIngestor implements SupervisedTask {

    private static final int SUMMARY_EVERY_UPDATES = 60;

    private final TradingState state;
    private final VenueGateway gateway;
    private final HftProperties.Ingest config;
    private final HftProperties.QuoteCache cacheConfig;
    private final Clock clock;

    private int cursor;
    private int updatesSinceSummary;
    private boolean initialPopulation = true;

    public PriceIngestor(TradingState state, VenueGateway gateway, HftProperties.Engine engine, Clock clock) {
        this.state = Objects.requireNonNull(state, "state");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.config = engine.ingest();
        this.cacheConfig = engine.quoteCache();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String name() {
        return "price-ingestor";
    }

    @Override
    public void run() throws InterruptedException {
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism(), r -> {
            Thread t = new Thread(r, "polyspike-ingest-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            while (!state.isShutdown()) {
                long started = clock.millis();
                try {
                    pollOnce(pool);
                } catch (RuntimeException e) {
                    log.error("INGEST: poll failed: {}", e.toString(), e);
                }
                long remaining = config.minIntervalMillis() - (clock.millis() - started);
                if (state.awaitShutdown(Duration.ofMillis(Math.max(remaining, 1L)))) {
                    return;
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Fetches the next batch and records one price per instrument with a usable quote. Returns the number recorded.
     */
    int pollOnce(ExecutorService pool) throws InterruptedException {
        List<String> batch = nextBatch();
        if (batch.isEmpty()) {
            return 0;
        }
        Map<String, QuoteResult> results = new LinkedHashMap<>(gateway.getQuotes(batch));

        List<String> missing = new ArrayList<>();
        for (String instrument : batch) {
            if (!results.containsKey(instrument)) {
                missing.add(instrument);
            }
        }
        if (!missing.isEmpty() && Boolean.TRUE.equals(config.fallbackEnabled())) {
            results.putAll(fetchIndividually(missing, pool));
        }

        Instant now = clock.instant();
        Map<String, VenueQuote> fresh = new LinkedHashMap<>();
        int recorded = 0;
        for (String instrument : batch) {
            QuoteResult result = results.get(instrument);
            if (result == null || !result.isOk()) {
                if (result != null) {
                    log.debug("INGEST: {} skipped ({}: {})", instrument, result.status(), result.detail());
                }
                continue;
            }
            VenueQuote quote = result.quote();
            fresh.put(instrument, quote);
            Optional<BigDecimal> mid = quote.mid();
            if (mid.isEmpty()) {
                log.debug("INGEST: {} has neither bid nor ask", instrument);
                continue;
            }
            InstrumentMeta meta = state.getInstrumentMeta(instrument);
            if (state.addPrice(instrument, now, mid.get(), meta.eventSlug(), meta.outcome())) {
                recorded++;
            }
        }

        if (Boolean.TRUE.equals(cacheConfig.enabled()) && !fresh.isEmpty()) {
            state.cacheQuotes(fresh);
        }
        if (recorded > 0) {
            state.signalPriceUpdate();
            logProgress(recorded, batch.size());
        }
        return recorded;
    }

    private Map<String, QuoteResult> fetchIndividually(List<String> instruments, ExecutorService pool)
            throws InterruptedException {
        List<Callable<QuoteResult>> calls = new ArrayList<>(instruments.size());
        for (String instrument : instruments) {
            calls.add(() -> gateway.getQuote(instrument));
        }
        List<Future<QuoteResult>> futures = pool.invokeAll(calls);
        Map<String, QuoteResult> out = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                out.put(instruments.get(i), futures.get(i).get());
            } catch (ExecutionException e) {
                log.debug("INGEST: quote for {} failed: {}", instruments.get(i), e.getCause().toString());
            }
        }
        return out;
    }

    private List<String> nextBatch() {
        List<String> tracked = state.trackedInstruments();
        int size = config.batchSize();
        if (tracked.isEmpty() || size <= 0 || size >= tracked.size()) {
            return tracked;
        }
        List<String> batch = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            batch.add(tracked.get((cursor + i) % tracked.size()));
        }
        cursor = (cursor + size) % tracked.size();
        return batch;
    }

    private void logProgress(int recorded, int batchSize) {
        if (initialPopulation) {
            initialPopulation = false;
            log.info("INGEST: initial price data populated ({} of {} instruments)", recorded, batchSize);
        }
        updatesSinceSummary += recorded;
        if (updatesSinceSummary >= SUMMARY_EVERY_UPDATES) {
            log.info("INGEST: {} price updates recorded across {} tracked instruments",
                    updatesSinceSummary, state.trackedInstruments().size());
            updatesSinceSummary = 0;
        }
    }
}
