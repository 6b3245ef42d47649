package com.polyspike.hft.engine.state;

import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.engine.venue.VenueQuote;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared engine state: price history, trades, positions, pairs, marks, simulated ledger and quote cache.
 * <p>
 * Every concern has its own lock and no method holds two of them at once. Accessors copy values in and out; callers
 * never see internal collections.
 */
@Slf4j
public class TradingState {

    private final int priceHistorySize;
    private final int maxConcurrentTrades;

    private final ReentrantLock priceLock = new ReentrantLock();
    private final Map<String, ArrayDeque<PricePoint>> priceHistory = new HashMap<>();

    private final ReentrantLock tradesLock = new ReentrantLock();
    private final Map<String, ActiveTrade> activeTrades = new LinkedHashMap<>();

    private final ReentrantLock positionsLock = new ReentrantLock();
    private final Map<String, List<PositionInfo>> positions = new LinkedHashMap<>();
    private BigDecimal simulatedRealizedPnl = BigDecimal.ZERO;

    private final ReentrantLock pairsLock = new ReentrantLock();
    private final Map<String, String> pairs = new HashMap<>();
    private final Map<String, InstrumentMeta> instruments = new LinkedHashMap<>();

    private final ReentrantLock marksLock = new ReentrantLock();
    private final Map<String, Instant> lastBuyAt = new HashMap<>();
    private final Map<String, Instant> lastSellAt = new HashMap<>();
    private final Set<String> boughtOnce = new HashSet<>();
    private Instant lastTradeClosedAt;

    private final ReentrantLock ledgerLock = new ReentrantLock();
    private BigDecimal simulatedBalance;

    private final ReentrantLock inFlightLock = new ReentrantLock();
    private final Set<String> inFlightOrders = new HashSet<>();

    private final ReentrantLock slotLock = new ReentrantLock();
    private int reservedSlots;

    private final ReentrantLock quoteLock = new ReentrantLock();
    private final Map<String, VenueQuote> quoteCache = new HashMap<>();

    private final PriceUpdateSignal priceUpdates = new PriceUpdateSignal();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final CountDownLatch shutdownRequested = new CountDownLatch(1);
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final CountDownLatch cleanupComplete = new CountDownLatch(1);
    private final AtomicLong scans = new AtomicLong();

    public TradingState(int priceHistorySize, int maxConcurrentTrades, BigDecimal startingBalance) {
        if (priceHistorySize < 2) {
            throw new IllegalArgumentException("priceHistorySize must be >= 2");
        }
        if (maxConcurrentTrades < 1) {
            throw new IllegalArgumentException("maxConcurrentTrades must be >= 1");
        }
        this.priceHistorySize = priceHistorySize;
        this.maxConcurrentTrades = maxConcurrentTrades;
        this.simulatedBalance = startingBalance == null ? BigDecimal.ZERO : startingBalance.max(BigDecimal.ZERO);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Price history

    /**
     * Appends to the instrument's ring, creating it on first use. Prices outside [0, 1] are refused.
     */
    public boolean addPrice(String instrument, Instant ts, BigDecimal price, String eventSlug, String outcome) {
        if (instrument == null || ts == null || price == null) {
            return false;
        }
        if (price.signum() < 0 || price.compareTo(BigDecimal.ONE) > 0) {
            log.debug("STATE: rejected out-of-range price {} for {}", price, instrument);
            return false;
        }
        PricePoint point = new PricePoint(ts, price, eventSlug, outcome);
        priceLock.lock();
        try {
            ArrayDeque<PricePoint> ring = priceHistory.computeIfAbsent(instrument, k -> new ArrayDeque<>(priceHistorySize));
            if (ring.size() >= priceHistorySize) {
                ring.pollFirst();
            }
            ring.addLast(point);
            return true;
        } finally {
            priceLock.unlock();
        }
    }

    public List<PricePoint> getPriceHistory(String instrument) {
        priceLock.lock();
        try {
            ArrayDeque<PricePoint> ring = priceHistory.get(instrument);
            return ring == null ? List.of() : List.copyOf(ring);
        } finally {
            priceLock.unlock();
        }
    }

    public Optional<PricePoint> latestPrice(String instrument) {
        priceLock.lock();
        try {
            ArrayDeque<PricePoint> ring = priceHistory.get(instrument);
            return ring == null ? Optional.empty() : Optional.ofNullable(ring.peekLast());
        } finally {
            priceLock.unlock();
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Active trades

    /**
     * Adds a trade unless one already exists for the instrument.
     */
    public boolean addActiveTrade(ActiveTrade trade) {
        tradesLock.lock();
        try {
            return activeTrades.putIfAbsent(trade.instrument(), trade) == null;
        } finally {
            tradesLock.unlock();
        }
    }

    /**
     * Adds the trade, or folds it into the existing one. Returns true when a new trade was created.
     */
    public boolean addOrMergeActiveTrade(ActiveTrade trade) {
        tradesLock.lock();
        try {
            ActiveTrade existing = activeTrades.get(trade.instrument());
            if (existing == null) {
                activeTrades.put(trade.instrument(), trade);
                return true;
            }
            activeTrades.put(trade.instrument(), existing.mergedWith(trade));
            return false;
        } finally {
            tradesLock.unlock();
        }
    }

    public Optional<ActiveTrade> removeActiveTrade(String instrument) {
        tradesLock.lock();
        try {
            return Optional.ofNullable(activeTrades.remove(instrument));
        } finally {
            tradesLock.unlock();
        }
    }

    /**
     * Takes {@code shares} off the instrument's trade, removing it once nothing is left.
     */
    public ReduceOutcome reduceActiveTrade(String instrument, BigDecimal shares) {
        tradesLock.lock();
        try {
            ActiveTrade trade = activeTrades.get(instrument);
            if (trade == null) {
                return ReduceOutcome.NO_TRADE;
            }
            BigDecimal remaining = trade.shares().subtract(shares);
            if (remaining.signum() <= 0) {
                activeTrades.remove(instrument);
                return ReduceOutcome.CLOSED;
            }
            activeTrades.put(instrument, trade.withShares(remaining));
            return ReduceOutcome.REDUCED;
        } finally {
            tradesLock.unlock();
        }
    }

    public Map<String, ActiveTrade> getActiveTrades() {
        tradesLock.lock();
        try {
            return new LinkedHashMap<>(activeTrades);
        } finally {
            tradesLock.unlock();
        }
    }

    public Optional<ActiveTrade> getActiveTrade(String instrument) {
        tradesLock.lock();
        try {
            return Optional.ofNullable(activeTrades.get(instrument));
        } finally {
            tradesLock.unlock();
        }
    }

    public int activeTradeCount() {
        tradesLock.lock();
        try {
            return activeTrades.size();
        } finally {
            tradesLock.unlock();
        }
    }

    public enum ReduceOutcome {
        NO_TRADE,
        REDUCED,
        CLOSED,
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Trade slots and in-flight orders

    public boolean tryReserveTradeSlot() {
        slotLock.lock();
        try {
            if (reservedSlots >= maxConcurrentTrades) {
                return false;
            }
            reservedSlots++;
            return true;
        } finally {
            slotLock.unlock();
        }
    }

    public void releaseTradeSlot() {
        slotLock.lock();
        try {
            if (reservedSlots > 0) {
                reservedSlots--;
            }
        } finally {
            slotLock.unlock();
        }
    }

    public int reservedTradeSlots() {
        slotLock.lock();
        try {
            return reservedSlots;
        } finally {
            slotLock.unlock();
        }
    }

    public int availableTradeSlots() {
        slotLock.lock();
        try {
            return maxConcurrentTrades - reservedSlots;
        } finally {
            slotLock.unlock();
        }
    }

    /**
     * Marks an order in flight for the instrument. Never blocks; false when one is already in flight.
     */
    public boolean tryAcquireAssetOrder(String instrument) {
        inFlightLock.lock();
        try {
            return inFlightOrders.add(instrument);
        } finally {
            inFlightLock.unlock();
        }
    }

    public void releaseAssetOrder(String instrument) {
        inFlightLock.lock();
        try {
            inFlightOrders.remove(instrument);
        } finally {
            inFlightLock.unlock();
        }
    }

    public int inFlightOrderCount() {
        inFlightLock.lock();
        try {
            return inFlightOrders.size();
        } finally {
            inFlightLock.unlock();
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Instruments and pairs

    public void registerInstrument(String instrument, InstrumentMeta meta) {
        if (instrument == null || instrument.isBlank()) {
            throw new IllegalArgumentException("instrument must not be blank");
        }
        pairsLock.lock();
        try {
            instruments.putIfAbsent(instrument, meta == null ? InstrumentMeta.UNKNOWN : meta);
        } finally {
            pairsLock.unlock();
        }
    }

    /**
     * Pairs two instruments in both directions. Refused when either side is already paired elsewhere.
     */
    public boolean addAssetPair(String a, String b) {
        if (a == null || b == null || a.equals(b)) {
            return false;
        }
        pairsLock.lock();
        try {
            String currentA = pairs.get(a);
            String currentB = pairs.get(b);
            if (b.equals(currentA) && a.equals(currentB)) {
                return true;
            }
            if (currentA != null || currentB != null) {
                log.warn("STATE: refusing to pair {} with {} (existing pairs: {} -> {}, {} -> {})",
                        a, b, a, currentA, b, currentB);
                return false;
            }
            pairs.put(a, b);
            pairs.put(b, a);
            instruments.putIfAbsent(a, InstrumentMeta.UNKNOWN);
            instruments.putIfAbsent(b, InstrumentMeta.UNKNOWN);
            return true;
        } finally {
            pairsLock.unlock();
        }
    }

    public Optional<String> getAssetPair(String instrument) {
        pairsLock.lock();
        try {
            return Optional.ofNullable(pairs.get(instrument));
        } finally {
            pairsLock.unlock();
        }
    }

    public InstrumentMeta getInstrumentMeta(String instrument) {
        pairsLock.lock();
        try {
            return instruments.getOrDefault(instrument, InstrumentMeta.UNKNOWN);
        } finally {
            pairsLock.unlock();
        }
    }

    public List<String> trackedInstruments() {
        pairsLock.lock();
        try {
            return List.copyOf(instruments.keySet());
        } finally {
            pairsLock.unlock();
        }
    }

    public void markInitialized() {
        initialized.set(true);
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Positions

    /**
     * Replaces the whole positions snapshot, grouped by market. Invalid entries are dropped.
     */
    public void replacePositions(Map<String, List<PositionInfo>> snapshot) {
        Map<String, List<PositionInfo>> cleaned = new LinkedHashMap<>();
        if (snapshot != null) {
            snapshot.forEach((market, list) -> {
                if (market == null || list == null) {
                    return;
                }
                List<PositionInfo> valid = new ArrayList<>(list.size());
                for (PositionInfo p : list) {
                    if (p != null && p.isValid()) {
                        valid.add(p);
                    } else {
                        log.warn("STATE: dropping invalid position in market {}: {}", market, p);
                    }
                }
                if (!valid.isEmpty()) {
                    cleaned.put(market, List.copyOf(valid));
                }
            });
        }
        positionsLock.lock();
        try {
            positions.clear();
            positions.putAll(cleaned);
        } finally {
            positionsLock.unlock();
        }
    }

    public Map<String, List<PositionInfo>> getPositions() {
        positionsLock.lock();
        try {
            Map<String, List<PositionInfo>> copy = new LinkedHashMap<>();
            positions.forEach((k, v) -> copy.put(k, List.copyOf(v)));
            return copy;
        } finally {
            positionsLock.unlock();
        }
    }

    public Optional<PositionInfo> findPosition(String asset) {
        positionsLock.lock();
        try {
            return positions.values().stream()
                    .flatMap(List::stream)
                    .filter(p -> p.asset().equals(asset))
                    .findFirst();
        } finally {
            positionsLock.unlock();
        }
    }

    /**
     * Adds a simulated fill to the position, keeping a share-weighted average price.
     */
    public PositionInfo upsertSimulatedPosition(String asset, BigDecimal shares, BigDecimal price, InstrumentMeta meta) {
        InstrumentMeta m = meta == null ? InstrumentMeta.UNKNOWN : meta;
        String market = m.eventSlug().isEmpty() ? asset : m.eventSlug();
        positionsLock.lock();
        try {
            List<PositionInfo> list = new ArrayList<>(positions.getOrDefault(market, List.of()));
            int idx = indexOfAsset(list, asset);
            PositionInfo updated;
            if (idx < 0) {
                updated = PositionInfo.of(m.eventSlug(), m.outcome(), asset, price, shares, price, BigDecimal.ZERO);
                list.add(updated);
            } else {
                PositionInfo old = list.get(idx);
                BigDecimal total = old.shares().add(shares);
                BigDecimal avg = total.signum() == 0
                        ? price
                        : old.avgPrice().multiply(old.shares()).add(price.multiply(shares))
                                .divide(total, 6, RoundingMode.HALF_UP);
                updated = PositionInfo.of(old.eventSlug(), old.outcome(), asset, avg, total, price, old.realizedPnl());
                list.set(idx, updated);
            }
            positions.put(market, List.copyOf(list));
            return updated;
        } finally {
            positionsLock.unlock();
        }
    }

    /**
     * Sells simulated shares at {@code price}. Returns the realized PnL; the position is removed at zero shares.
     */
    public BigDecimal reduceSimulatedPosition(String asset, BigDecimal shares, BigDecimal price) {
        positionsLock.lock();
        try {
            for (Map.Entry<String, List<PositionInfo>> entry : positions.entrySet()) {
                List<PositionInfo> list = new ArrayList<>(entry.getValue());
                int idx = indexOfAsset(list, asset);
                if (idx < 0) {
                    continue;
                }
                PositionInfo old = list.get(idx);
                BigDecimal sold = shares.min(old.shares());
                BigDecimal realized = price.subtract(old.avgPrice()).multiply(sold).setScale(6, RoundingMode.HALF_UP);
                simulatedRealizedPnl = simulatedRealizedPnl.add(realized);
                BigDecimal remaining = old.shares().subtract(sold);
                if (remaining.signum() <= 0) {
                    list.remove(idx);
                } else {
                    list.set(idx, PositionInfo.of(old.eventSlug(), old.outcome(), asset, old.avgPrice(), remaining,
                            price, old.realizedPnl().add(realized)));
                }
                if (list.isEmpty()) {
                    positions.remove(entry.getKey());
                } else {
                    entry.setValue(List.copyOf(list));
                }
                return realized;
            }
            return BigDecimal.ZERO;
        } finally {
            positionsLock.unlock();
        }
    }

    public BigDecimal simulatedRealizedPnl() {
        positionsLock.lock();
        try {
            return simulatedRealizedPnl;
        } finally {
            positionsLock.unlock();
        }
    }

    private static int indexOfAsset(List<PositionInfo> list, String asset) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).asset().equals(asset)) {
                return i;
            }
        }
        return -1;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Recent-trade marks

    public void markRecentTrade(String instrument, OrderSide side, Instant at) {
        marksLock.lock();
        try {
            (side == OrderSide.BUY ? lastBuyAt : lastSellAt).put(instrument, at);
        } finally {
            marksLock.unlock();
        }
    }

    public Optional<Instant> lastTradeAt(String instrument, OrderSide side) {
        marksLock.lock();
        try {
            return Optional.ofNullable((side == OrderSide.BUY ? lastBuyAt : lastSellAt).get(instrument));
        } finally {
            marksLock.unlock();
        }
    }

    public boolean isWithinCooldown(String instrument, OrderSide side, Instant now, Duration cooldown) {
        if (cooldown.isZero() || cooldown.isNegative()) {
            return false;
        }
        return lastTradeAt(instrument, side)
                .map(at -> Duration.between(at, now).compareTo(cooldown) < 0)
                .orElse(false);
    }

    public void markBoughtOnce(String instrument) {
        marksLock.lock();
        try {
            boughtOnce.add(instrument);
        } finally {
            marksLock.unlock();
        }
    }

    public boolean hasBoughtOnce(String instrument) {
        marksLock.lock();
        try {
            return boughtOnce.contains(instrument);
        } finally {
            marksLock.unlock();
        }
    }

    public void markTradeClosed(Instant at) {
        marksLock.lock();
        try {
            lastTradeClosedAt = at;
        } finally {
            marksLock.unlock();
        }
    }

    public Optional<Instant> lastTradeClosedAt() {
        marksLock.lock();
        try {
            return Optional.ofNullable(lastTradeClosedAt);
        } finally {
            marksLock.unlock();
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Simulated ledger

    public BigDecimal simulatedBalance() {
        ledgerLock.lock();
        try {
            return simulatedBalance;
        } finally {
            ledgerLock.unlock();
        }
    }

    /**
     * Debits the ledger if it holds at least {@code amount}.
     */
    public boolean tryDebitSimulatedBalance(BigDecimal amount) {
        ledgerLock.lock();
        try {
            if (amount.signum() < 0 || simulatedBalance.compareTo(amount) < 0) {
                return false;
            }
            simulatedBalance = simulatedBalance.subtract(amount);
            return true;
        } finally {
            ledgerLock.unlock();
        }
    }

    public void creditSimulatedBalance(BigDecimal amount) {
        ledgerLock.lock();
        try {
            simulatedBalance = simulatedBalance.add(amount).max(BigDecimal.ZERO);
        } finally {
            ledgerLock.unlock();
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Quote cache

    public void cacheQuotes(Map<String, VenueQuote> quotes) {
        quoteLock.lock();
        try {
            quotes.forEach((instrument, quote) -> {
                if (quote != null) {
                    quoteCache.put(instrument, quote);
                }
            });
        } finally {
            quoteLock.unlock();
        }
    }

    public Optional<VenueQuote> getCachedQuote(String instrument, Duration ttl, Instant now) {
        quoteLock.lock();
        try {
            VenueQuote quote = quoteCache.get(instrument);
            if (quote == null || quote.fetchedAt() == null) {
                return Optional.empty();
            }
            return Duration.between(quote.fetchedAt(), now).compareTo(ttl) <= 0 ? Optional.of(quote) : Optional.empty();
        } finally {
            quoteLock.unlock();
        }
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Signalling and lifecycle

    public void signalPriceUpdate() {
        priceUpdates.signal();
    }

    public long priceUpdateVersion() {
        return priceUpdates.version();
    }

    public long awaitPriceUpdate(long lastSeenVersion, Duration timeout) throws InterruptedException {
        return priceUpdates.awaitUpdate(lastSeenVersion, timeout);
    }

    /**
     * Raises the shutdown flag and wakes every waiter so loops notice promptly.
     */
    public void requestShutdown() {
        if (shutdown.compareAndSet(false, true)) {
            shutdownRequested.countDown();
            priceUpdates.signal();
        }
    }

    /**
     * Sleeps for {@code timeout} unless shutdown is requested first. Returns true when shutting down.
     */
    public boolean awaitShutdown(Duration timeout) throws InterruptedException {
        if (timeout.isNegative() || timeout.isZero()) {
            return isShutdown();
        }
        return shutdownRequested.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public void markCleanupComplete() {
        cleanupComplete.countDown();
    }

    public boolean awaitCleanup(Duration timeout) throws InterruptedException {
        return cleanupComplete.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public long incrementScanCounter() {
        return scans.incrementAndGet();
    }

    public StateSnapshot statusSnapshot() {
        return new StateSnapshot(
                trackedInstruments().size(),
                activeTradeCount(),
                reservedTradeSlots(),
                inFlightOrderCount(),
                simulatedBalance(),
                scans.get()
        );
    }

    /**
     * Clears every collection. Only meaningful once workers have stopped.
     */
    public void cleanup() {
        priceLock.lock();
        try {
            priceHistory.clear();
        } finally {
            priceLock.unlock();
        }
        tradesLock.lock();
        try {
            activeTrades.clear();
        } finally {
            tradesLock.unlock();
        }
        positionsLock.lock();
        try {
            positions.clear();
        } finally {
            positionsLock.unlock();
        }
        pairsLock.lock();
        try {
            pairs.clear();
            instruments.clear();
        } finally {
            pairsLock.unlock();
        }
        marksLock.lock();
        try {
            lastBuyAt.clear();
            lastSellAt.clear();
            boughtOnce.clear();
        } finally {
            marksLock.unlock();
        }
        inFlightLock.lock();
        try {
            inFlightOrders.clear();
        } finally {
            inFlightLock.unlock();
        }
        slotLock.lock();
        try {
            reservedSlots = 0;
        } finally {
            slotLock.unlock();
        }
        quoteLock.lock();
        try {
            quoteCache.clear();
        } finally {
            quoteLock.unlock();
        }
    }

    public record StateSnapshot(
            int trackedInstruments,
            int activeTrades,
            int reservedSlots,
            int inFlightOrders,
            BigDecimal simulatedBalance,
            long scans
    ) {
    }
}
