package com.polyspike.hft.engine.state;

import com.polyspike.hft.domain.OrderSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradingStateTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final TradingState state = new TradingState(3, 2, new BigDecimal("100"));

    @Test
    void priceHistoryEvictsOldestAndReturnsSnapshot() {
        for (int i = 0; i < 5; i++) {
            assertThat(state.addPrice("A", T0.plusSeconds(i), new BigDecimal("0.4" + i), "ev", "Yes")).isTrue();
        }

        List<PricePoint> history = state.getPriceHistory("A");

        assertThat(history).extracting(PricePoint::price)
                .containsExactly(new BigDecimal("0.42"), new BigDecimal("0.43"), new BigDecimal("0.44"));
        assertThatThrownBy(() -> history.add(history.get(0))).isInstanceOf(UnsupportedOperationException.class);
        state.addPrice("A", T0.plusSeconds(10), new BigDecimal("0.50"), "ev", "Yes");
        assertThat(history).hasSize(3);
        assertThat(history.get(2).price()).isEqualByComparingTo("0.44");
    }

    @Test
    void addPriceRejectsValuesOutsideUnitInterval() {
        assertThat(state.addPrice("A", T0, new BigDecimal("1.01"), "", "")).isFalse();
        assertThat(state.addPrice("A", T0, new BigDecimal("-0.01"), "", "")).isFalse();
        assertThat(state.addPrice("A", T0, BigDecimal.ONE, "", "")).isTrue();
        assertThat(state.getPriceHistory("A")).hasSize(1);
        assertThat(state.getPriceHistory("unknown")).isEmpty();
    }

    @Test
    void tradeSlotsNeverExceedLimitUnderContention() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<Boolean>> calls = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            calls.add(() -> {
                start.await();
                return state.tryReserveTradeSlot();
            });
        }
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (Callable<Boolean> c : calls) {
                futures.add(pool.submit(c));
            }
            start.countDown();
            int granted = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(2);
            assertThat(state.reservedTradeSlots()).isEqualTo(2);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void releasingMoreSlotsThanReservedStopsAtZero() {
        assertThat(state.tryReserveTradeSlot()).isTrue();
        state.releaseTradeSlot();
        state.releaseTradeSlot();

        assertThat(state.reservedTradeSlots()).isZero();
        assertThat(state.availableTradeSlots()).isEqualTo(2);
    }

    @Test
    void assetOrderLockIsExclusiveAndDoubleReleaseIsHarmless() {
        assertThat(state.tryAcquireAssetOrder("A")).isTrue();
        assertThat(state.tryAcquireAssetOrder("A")).isFalse();
        assertThat(state.tryAcquireAssetOrder("B")).isTrue();

        state.releaseAssetOrder("A");
        state.releaseAssetOrder("A");

        assertThat(state.tryAcquireAssetOrder("A")).isTrue();
        assertThat(state.inFlightOrderCount()).isEqualTo(2);
    }

    @Test
    void pairsAreSymmetricAndRepairingIsRefused() {
        assertThat(state.addAssetPair("A", "B")).isTrue();
        assertThat(state.addAssetPair("B", "A")).isTrue();

        assertThat(state.getAssetPair("A")).contains("B");
        assertThat(state.getAssetPair("B")).contains("A");
        assertThat(state.addAssetPair("A", "C")).isFalse();
        assertThat(state.addAssetPair("C", "B")).isFalse();
        assertThat(state.getAssetPair("C")).isEmpty();
        assertThat(state.trackedInstruments()).containsExactly("A", "B");
    }

    @Test
    void activeTradesAreReturnedAsCopies() {
        state.addActiveTrade(trade("A", "0.40", "10"));

        Map<String, ActiveTrade> copy = state.getActiveTrades();
        copy.clear();

        assertThat(state.getActiveTrades()).containsOnlyKeys("A");
        assertThat(state.addActiveTrade(trade("A", "0.50", "5"))).isFalse();
    }

    @Test
    void mergingAFillKeepsWeightedEntryAndEarliestTime() {
        assertThat(state.addOrMergeActiveTrade(trade("A", "0.40", "10"))).isTrue();
        ActiveTrade later = new ActiveTrade("A", new BigDecimal("0.60"), T0.plusSeconds(30),
                new BigDecimal("6"), BigDecimal.TEN, true);

        assertThat(state.addOrMergeActiveTrade(later)).isFalse();

        ActiveTrade merged = state.getActiveTrade("A").orElseThrow();
        assertThat(merged.shares()).isEqualByComparingTo("20");
        assertThat(merged.entryPrice()).isEqualByComparingTo("0.50");
        assertThat(merged.entryTime()).isEqualTo(T0);
    }

    @Test
    void reducingActiveTradeKeepsRemainderThenCloses() {
        state.addActiveTrade(trade("A", "0.40", "10"));

        assertThat(state.reduceActiveTrade("A", new BigDecimal("4"))).isEqualTo(TradingState.ReduceOutcome.REDUCED);
        assertThat(state.getActiveTrade("A").orElseThrow().shares()).isEqualByComparingTo("6");
        assertThat(state.reduceActiveTrade("A", new BigDecimal("6"))).isEqualTo(TradingState.ReduceOutcome.CLOSED);
        assertThat(state.getActiveTrade("A")).isEmpty();
        assertThat(state.reduceActiveTrade("A", BigDecimal.ONE)).isEqualTo(TradingState.ReduceOutcome.NO_TRADE);
    }

    @Test
    void simulatedLedgerNeverGoesNegative() {
        assertThat(state.tryDebitSimulatedBalance(new BigDecimal("60"))).isTrue();
        assertThat(state.tryDebitSimulatedBalance(new BigDecimal("60"))).isFalse();
        assertThat(state.simulatedBalance()).isEqualByComparingTo("40");

        state.creditSimulatedBalance(new BigDecimal("-100"));

        assertThat(state.simulatedBalance()).isEqualByComparingTo("0");
    }

    @Test
    void simulatedPositionsAverageAndRealizePnl() {
        InstrumentMeta meta = new InstrumentMeta("ev", "Yes");
        state.upsertSimulatedPosition("A", BigDecimal.TEN, new BigDecimal("0.40"), meta);
        state.upsertSimulatedPosition("A", BigDecimal.TEN, new BigDecimal("0.60"), meta);

        PositionInfo position = state.findPosition("A").orElseThrow();
        assertThat(position.shares()).isEqualByComparingTo("20");
        assertThat(position.avgPrice()).isEqualByComparingTo("0.50");

        BigDecimal realized = state.reduceSimulatedPosition("A", new BigDecimal("20"), new BigDecimal("0.70"));

        assertThat(realized).isEqualByComparingTo("4");
        assertThat(state.simulatedRealizedPnl()).isEqualByComparingTo("4");
        assertThat(state.findPosition("A")).isEmpty();
        assertThat(state.getPositions()).isEmpty();
    }

    @Test
    void replacePositionsDropsInvalidEntries() {
        PositionInfo good = PositionInfo.of("ev", "Yes", "A", new BigDecimal("0.4"), BigDecimal.TEN, null, null);
        PositionInfo bad = PositionInfo.of("ev", "No", "", new BigDecimal("0.4"), BigDecimal.TEN, null, null);

        state.replacePositions(Map.of("cond-1", List.of(good, bad)));

        assertThat(state.getPositions().get("cond-1")).extracting(PositionInfo::asset).containsExactly("A");
    }

    @Test
    void cooldownIsMeasuredPerSide() {
        state.markRecentTrade("A", OrderSide.BUY, T0);

        assertThat(state.isWithinCooldown("A", OrderSide.BUY, T0.plusSeconds(30), Duration.ofSeconds(60))).isTrue();
        assertThat(state.isWithinCooldown("A", OrderSide.BUY, T0.plusSeconds(61), Duration.ofSeconds(60))).isFalse();
        assertThat(state.isWithinCooldown("A", OrderSide.SELL, T0.plusSeconds(1), Duration.ofSeconds(60))).isFalse();
    }

    @Test
    void priceUpdateSignalWakesWaiterAndShutdownWakesEveryone() throws Exception {
        long seen = state.priceUpdateVersion();
        state.signalPriceUpdate();

        assertThat(state.awaitPriceUpdate(seen, Duration.ofMillis(10))).isGreaterThan(seen);

        state.requestShutdown();
        assertThat(state.isShutdown()).isTrue();
        assertThat(state.awaitShutdown(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void cleanupClearsEverything() throws Exception {
        state.addPrice("A", T0, new BigDecimal("0.5"), "", "");
        state.addAssetPair("A", "B");
        state.addActiveTrade(trade("A", "0.5", "1"));

        state.cleanup();
        state.markCleanupComplete();

        assertThat(state.getPriceHistory("A")).isEmpty();
        assertThat(state.getActiveTrades()).isEmpty();
        assertThat(state.trackedInstruments()).isEmpty();
        assertThat(state.awaitCleanup(Duration.ofMillis(10))).isTrue();
    }

    private static ActiveTrade trade(String instrument, String price, String shares) {
        BigDecimal p = new BigDecimal(price);
        BigDecimal s = new BigDecimal(shares);
        return new ActiveTrade(instrument, p, T0, p.multiply(s), s, true);
    }
}
