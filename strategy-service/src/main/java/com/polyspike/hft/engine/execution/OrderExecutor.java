package com.polyspike.hft.engine.execution;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.engine.signal.TradeIntent;
import com.polyspike.hft.engine.state.ActiveTrade;
import com.polyspike.hft.engine.state.PositionInfo;
import com.polyspike.hft.engine.state.PricePoint;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.venue.DepthLevel;
import com.polyspike.hft.engine.venue.OrderAck;
import com.polyspike.hft.engine.venue.QuoteResult;
import com.polyspike.hft.engine.venue.VenueGateway;
import com.polyspike.hft.engine.venue.VenueOrder;
import com.polyspike.hft.engine.venue.VenueQuote;
import com.polyspike.hft.events.HftEventPublisher;
import com.polyspike.hft.events.HftEventTypes;
import com.polyspike.hft.strategy.metrics.StrategyMetricsService;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Places buys, sells and passive quotes against the venue or the simulated ledger.
 * <p>
 * A buy holds a trade slot and the instrument's in-flight mark for its whole duration; a sell or quote holds only the
 * in-flight mark. Both are taken before the first venue call and released in {@code finally}. A slot reserved by a
 * buy that opens a new trade stays reserved until that trade is fully closed.
 */
@Slf4j
public class OrderExecutor {

    private static final int SHARE_SCALE = 2;
    private static final int USD_SCALE = 6;

    private final TradingState state;
    private final VenueGateway gateway;
    private final HftProperties properties;
    private final Clock clock;
    private final HftEventPublisher events;
    private final StrategyMetricsService metrics;

    public OrderExecutor(TradingState state,
                         VenueGateway gateway,
                         HftProperties properties,
                         Clock clock,
                         HftEventPublisher events,
                         StrategyMetricsService metrics) {
        this.state = Objects.requireNonNull(state, "state");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = Objects.requireNonNull(events, "events");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public boolean execute(TradeIntent intent) {
        return switch (intent.action()) {
            case BUY -> placeBuy(intent.instrument(), intent.reason());
            case SELL -> placeSell(intent.instrument(), intent.reason());
            case QUOTE -> placeQuote(intent);
        };
    }

    public boolean placeBuy(String instrument, String reason) {
        if (state.isShutdown()) {
            return false;
        }
        if (properties.risk().killSwitch()) {
            return skip(instrument, OrderSide.BUY, "kill switch engaged");
        }
        if (!state.tryReserveTradeSlot()) {
            return skip(instrument, OrderSide.BUY, "no free trade slot");
        }
        boolean slotHandedOver = false;
        if (!state.tryAcquireAssetOrder(instrument)) {
            state.releaseTradeSlot();
            return skip(instrument, OrderSide.BUY, "order already in flight");
        }
        try {
            if (state.isWithinCooldown(instrument, OrderSide.BUY, clock.instant(), buyCooldown())) {
                return skip(instrument, OrderSide.BUY, "buy cooldown active");
            }
            if (Boolean.TRUE.equals(trading().singleEntryEnabled()) && boughtBefore(instrument)) {
                return skip(instrument, OrderSide.BUY, "already bought once on this pair");
            }

            Optional<VenueQuote> quote = quoteWithRetry(instrument);
            if (quote.isEmpty()) {
                return false;
            }
            Optional<DepthLevel> bestAsk = quote.get().bestAsk();
            if (bestAsk.isEmpty()) {
                return skip(instrument, OrderSide.BUY, "no ask");
            }
            BigDecimal ask = bestAsk.get().price();
            BigDecimal askSize = bestAsk.get().size();

            if (bestAsk.get().notional().compareTo(trading().minLiquidityUsd()) < 0) {
                return skip(instrument, OrderSide.BUY, "ask liquidity " + bestAsk.get().notional() + " below "
                        + trading().minLiquidityUsd());
            }
            Optional<PricePoint> last = state.latestPrice(instrument);
            if (last.isPresent() && ask.subtract(last.get().price()).compareTo(trading().slippageTolerance()) > 0) {
                return skip(instrument, OrderSide.BUY, "ask " + ask + " slipped from last " + last.get().price());
            }

            Optional<BigDecimal> capital = availableCapital();
            if (capital.isEmpty()) {
                return skip(instrument, OrderSide.BUY, "balance unavailable");
            }
            BigDecimal shares = sizeBuy(ask, askSize, capital.get());
            if (shares.signum() <= 0) {
                return skip(instrument, OrderSide.BUY, "computed size is zero (capital " + capital.get() + ")");
            }
            if (shares.subtract(trading().keepMinShares()).compareTo(trading().minSellShares()) < 0) {
                return skip(instrument, OrderSide.BUY, "size " + shares + " could not be sold again (minimum "
                        + trading().minSellShares() + ", kept " + trading().keepMinShares() + ")");
            }

            BigDecimal filled;
            if (properties.simulation()) {
                if (state.isShutdown()) {
                    return discardAfterShutdown(instrument, OrderSide.BUY);
                }
                BigDecimal cost = shares.multiply(ask).setScale(USD_SCALE, RoundingMode.HALF_UP);
                if (!state.tryDebitSimulatedBalance(cost)) {
                    return skip(instrument, OrderSide.BUY, "insufficient simulated balance for " + cost);
                }
                state.upsertSimulatedPosition(instrument, shares, ask, state.getInstrumentMeta(instrument));
                metrics.updateBalance(state.simulatedBalance());
                filled = shares;
            } else {
                BigDecimal usd = shares.multiply(ask).setScale(SHARE_SCALE, RoundingMode.DOWN);
                OrderAck ack = submitWithRetry(VenueOrder.fokBuy(instrument, usd, ask));
                if (!ack.isFilled()) {
                    return orderFailed(instrument, OrderSide.BUY, ack);
                }
                if (state.isShutdown()) {
                    return discardAfterShutdown(instrument, OrderSide.BUY);
                }
                filled = ack.filledAmount();
            }

            Instant now = clock.instant();
            BigDecimal amountUsd = filled.multiply(ask).setScale(USD_SCALE, RoundingMode.HALF_UP);
            slotHandedOver = state.addOrMergeActiveTrade(
                    new ActiveTrade(instrument, ask, now, amountUsd, filled, true));
            state.markRecentTrade(instrument, OrderSide.BUY, now);
            state.markBoughtOnce(instrument);

            log.info("EXEC: {}BUY {} shares of {} at {} (${}) reason={}",
                    simTag(), filled, instrument, ask, amountUsd, reason);
            publish(HftEventTypes.ENGINE_TRADE_OPENED, instrument, now,
                    new TradeEvent(instrument, OrderSide.BUY, filled, ask, reason, properties.simulation()));
            metrics.recordFill(OrderSide.BUY);
            return true;
        } finally {
            state.releaseAssetOrder(instrument);
            if (!slotHandedOver) {
                state.releaseTradeSlot();
            }
        }
    }

    public boolean placeSell(String instrument, String reason) {
        if (state.isShutdown()) {
            return false;
        }
        if (!state.tryAcquireAssetOrder(instrument)) {
            return skip(instrument, OrderSide.SELL, "order already in flight");
        }
        try {
            Optional<BigDecimal> held = heldShares(instrument);
            if (held.isEmpty()) {
                return skip(instrument, OrderSide.SELL, "nothing held");
            }
            BigDecimal sellable = held.get().subtract(trading().keepMinShares()).setScale(SHARE_SCALE, RoundingMode.DOWN);
            if (sellable.compareTo(trading().minSellShares()) < 0) {
                retireUnsellableTrade(instrument, held.get());
                return skip(instrument, OrderSide.SELL, "sellable " + sellable + " below minimum " + trading().minSellShares());
            }

            Optional<VenueQuote> quote = quoteWithRetry(instrument);
            if (quote.isEmpty()) {
                return false;
            }
            Optional<DepthLevel> bestBid = quote.get().bestBid();
            if (bestBid.isEmpty()) {
                return skip(instrument, OrderSide.SELL, "no bid");
            }
            BigDecimal depth = quote.get().bids().stream()
                    .map(DepthLevel::notional)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            if (depth.compareTo(trading().minLiquidityUsd()) < 0) {
                return skip(instrument, OrderSide.SELL, "bid liquidity " + depth + " below " + trading().minLiquidityUsd());
            }
            BigDecimal bid = bestBid.get().price();
            Optional<PricePoint> last = state.latestPrice(instrument);
            if (last.isPresent() && last.get().price().subtract(bid).compareTo(trading().slippageTolerance()) > 0) {
                return skip(instrument, OrderSide.SELL, "bid " + bid + " slipped from last " + last.get().price());
            }

            ExecutionPricing.Fill fill = ExecutionPricing.sweep(quote.get().bids(), sellable);
            if (fill.isEmpty()) {
                return skip(instrument, OrderSide.SELL, "no executable bid depth");
            }
            if (fill.partial()) {
                log.info("EXEC: book absorbs only {} of {} shares for {}", fill.shares(), sellable, instrument);
            }

            BigDecimal filled;
            BigDecimal price = fill.avgPrice();
            if (properties.simulation()) {
                if (state.isShutdown()) {
                    return discardAfterShutdown(instrument, OrderSide.SELL);
                }
                filled = fill.shares();
                state.creditSimulatedBalance(filled.multiply(price).setScale(USD_SCALE, RoundingMode.HALF_UP));
                BigDecimal realized = state.reduceSimulatedPosition(instrument, filled, price);
                metrics.updateBalance(state.simulatedBalance());
                metrics.addToRealizedPnl(realized);
            } else {
                OrderAck ack = submitWithRetry(VenueOrder.fokSell(instrument, fill.shares(), fill.worstPrice()));
                if (!ack.isFilled()) {
                    return orderFailed(instrument, OrderSide.SELL, ack);
                }
                if (state.isShutdown()) {
                    return discardAfterShutdown(instrument, OrderSide.SELL);
                }
                filled = ack.filledAmount().min(fill.shares());
            }

            Instant now = clock.instant();
            TradingState.ReduceOutcome outcome = state.reduceActiveTrade(instrument, filled);
            if (outcome == TradingState.ReduceOutcome.CLOSED) {
                state.releaseTradeSlot();
                state.markTradeClosed(now);
            } else if (outcome == TradingState.ReduceOutcome.REDUCED) {
                Optional<ActiveTrade> rest = state.getActiveTrade(instrument);
                if (rest.isPresent() && rest.get().shares().subtract(trading().keepMinShares())
                        .compareTo(trading().minSellShares()) < 0) {
                    retireUnsellableTrade(instrument, rest.get().shares());
                }
            }
            state.markRecentTrade(instrument, OrderSide.SELL, now);

            log.info("EXEC: {}SELL {} shares of {} at {} reason={} trade={}",
                    simTag(), filled, instrument, price, reason, outcome);
            publish(HftEventTypes.ENGINE_TRADE_CLOSED, instrument, now,
                    new TradeEvent(instrument, OrderSide.SELL, filled, price, reason, properties.simulation()));
            metrics.recordFill(OrderSide.SELL);
            return true;
        } finally {
            state.releaseAssetOrder(instrument);
        }
    }

    /**
     * Places a resting limit order. Simulation only logs it.
     */
    public boolean placeQuote(TradeIntent intent) {
        String instrument = intent.instrument();
        if (state.isShutdown()) {
            return false;
        }
        if (intent.side() == OrderSide.BUY && properties.risk().killSwitch()) {
            return skip(instrument, intent.side(), "kill switch engaged");
        }
        if (intent.quotePrice() == null || intent.quoteSize() == null || intent.quoteSize().signum() <= 0) {
            return skip(instrument, intent.side(), "quote without price or size");
        }
        if (!state.tryAcquireAssetOrder(instrument)) {
            return skip(instrument, intent.side(), "order already in flight");
        }
        try {
            String orderId = null;
            if (properties.simulation()) {
                log.info("EXEC: [SIM] quote {} {} @ {} on {}", intent.side(), intent.quoteSize(), intent.quotePrice(), instrument);
            } else {
                OrderAck ack = submitWithRetry(VenueOrder.gtc(instrument, intent.side(), intent.quoteSize(), intent.quotePrice()));
                if (ack.outcome() != OrderAck.Outcome.ACCEPTED && ack.outcome() != OrderAck.Outcome.FILLED) {
                    return orderFailed(instrument, intent.side(), ack);
                }
                orderId = ack.orderId();
                log.info("EXEC: quote {} {} @ {} on {} placed (orderId={})",
                        intent.side(), intent.quoteSize(), intent.quotePrice(), instrument, orderId);
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("instrument", instrument);
            data.put("side", intent.side());
            data.put("price", intent.quotePrice());
            data.put("size", intent.quoteSize());
            data.put("orderId", orderId);
            data.put("simulated", properties.simulation());
            publish(HftEventTypes.ENGINE_QUOTE_PLACED, instrument, clock.instant(), data);
            metrics.recordQuotePlaced();
            return true;
        } finally {
            state.releaseAssetOrder(instrument);
        }
    }

    /**
     * Stops tracking a trade whose remainder can no longer be sold, so it does not hold a slot forever.
     * The shares stay in the position ledger.
     */
    private void retireUnsellableTrade(String instrument, BigDecimal held) {
        if (state.removeActiveTrade(instrument).isEmpty()) {
            return;
        }
        state.releaseTradeSlot();
        state.markTradeClosed(clock.instant());
        log.info("EXEC: retiring trade on {} with {} unsellable shares (dust), slot released", instrument, held);
    }

    private Duration buyCooldown() {
        return Duration.ofSeconds(trading().cooldownSeconds());
    }

    private boolean boughtBefore(String instrument) {
        if (state.hasBoughtOnce(instrument)) {
            return true;
        }
        Optional<String> pair = state.getAssetPair(instrument);
        return pair.isPresent() && state.hasBoughtOnce(pair.get());
    }

    private Optional<BigDecimal> heldShares(String instrument) {
        Optional<ActiveTrade> trade = state.getActiveTrade(instrument);
        if (trade.isPresent()) {
            return Optional.of(trade.get().shares());
        }
        return state.findPosition(instrument).map(PositionInfo::shares).filter(s -> s.signum() > 0);
    }

    private Optional<BigDecimal> availableCapital() {
        if (properties.simulation()) {
            return Optional.of(state.simulatedBalance());
        }
        return gateway.getBalance();
    }

    private BigDecimal sizeBuy(BigDecimal ask, BigDecimal askSize, BigDecimal capital) {
        BigDecimal shares = askSize
                .min(trading().tradeUnitUsd().divide(ask, SHARE_SCALE, RoundingMode.DOWN))
                .min(capital.divide(ask, SHARE_SCALE, RoundingMode.DOWN));
        BigDecimal cap = properties.risk().maxOrderNotionalUsd();
        if (cap.signum() > 0) {
            shares = shares.min(cap.divide(ask, SHARE_SCALE, RoundingMode.DOWN));
        }
        return shares.setScale(SHARE_SCALE, RoundingMode.DOWN);
    }

    private Optional<VenueQuote> quoteWithRetry(String instrument) {
        int maxAttempts = trading().maxRetries();
        QuoteResult result = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            result = gateway.getQuote(instrument);
            if (result.status() != QuoteResult.Status.TRANSIENT || attempt == maxAttempts) {
                break;
            }
            log.debug("EXEC: transient quote failure for {} (attempt {}/{}): {}", instrument, attempt, maxAttempts, result.detail());
            if (!pauseBeforeRetry(attempt)) {
                break;
            }
        }
        if (result.isOk() && result.quote() != null) {
            return Optional.of(result.quote());
        }
        log.info("EXEC: no usable quote for {} ({}: {})", instrument, result.status(), result.detail());
        metrics.recordRejected();
        return Optional.empty();
    }

    private OrderAck submitWithRetry(VenueOrder order) {
        int maxAttempts = trading().maxRetries();
        OrderAck ack = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ack = gateway.submitOrder(order);
            if (ack.outcome() != OrderAck.Outcome.TRANSIENT || attempt == maxAttempts) {
                break;
            }
            log.warn("EXEC: transient {} failure for {} (attempt {}/{}): {}",
                    order.side(), order.instrument(), attempt, maxAttempts, ack.detail());
            if (!pauseBeforeRetry(attempt)) {
                break;
            }
        }
        return ack;
    }

    /**
     * Returns false when shutdown was requested (or the thread interrupted) during the pause.
     */
    private boolean pauseBeforeRetry(int attempt) {
        long delay = backoffMillis(attempt);
        try {
            return !state.awaitShutdown(Duration.ofMillis(delay));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    long backoffMillis(int attempt) {
        long base = trading().retryBaseDelayMillis();
        long max = trading().retryMaxDelayMillis();
        int shift = Math.min(Math.max(0, attempt - 1), 20);
        long exp = Math.min(max, base * (1L << shift));
        long jitter = trading().retryJitterMillis();
        return exp + (jitter > 0 ? ThreadLocalRandom.current().nextLong(jitter + 1) : 0L);
    }

    private boolean orderFailed(String instrument, OrderSide side, OrderAck ack) {
        if (ack.outcome() == OrderAck.Outcome.REJECTED) {
            log.warn("EXEC: {} {} rejected by venue: {}", side, instrument, ack.detail());
            metrics.recordRejected();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("instrument", instrument);
            data.put("side", side);
            data.put("detail", ack.detail());
            publish(HftEventTypes.ENGINE_ORDER_REJECTED, instrument, clock.instant(), data);
        } else {
            log.warn("EXEC: {} {} failed with outcome {}: {}", side, instrument, ack.outcome(), ack.detail());
            metrics.recordFailed();
        }
        return false;
    }

    private boolean discardAfterShutdown(String instrument, OrderSide side) {
        log.warn("EXEC: discarding {} result for {}, shutdown in progress", side, instrument);
        return false;
    }

    private boolean skip(String instrument, OrderSide side, String why) {
        log.info("EXEC: skip {} {}: {}", side, instrument, why);
        metrics.recordRejected();
        return false;
    }

    private void publish(String type, String key, Instant ts, Object data) {
        if (!events.isEnabled()) {
            return;
        }
        try {
            events.publish(ts, type, key, data);
        } catch (RuntimeException e) {
            log.debug("EXEC: event publish failed type={}: {}", type, e.toString());
        }
    }

    private String simTag() {
        return properties.simulation() ? "[SIM] " : "";
    }

    private HftProperties.Trading trading() {
        return properties.engine().trading();
    }
}
