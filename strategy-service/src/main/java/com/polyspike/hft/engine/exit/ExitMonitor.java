package com.polyspike.hft.engine.exit;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.execution.OrderExecutor;
import com.polyspike.hft.engine.state.ActiveTrade;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.supervisor.SupervisedTask;
import com.polyspike.hft.engine.venue.DepthLevel;
import com.polyspike.hft.engine.venue.QuoteSource;
import com.polyspike.hft.engine.venue.VenueQuote;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Closes active trades on holding time, take profit or stop loss, checked in that order.
 * A failed sell leaves the trade in place for the next cycle.
 */
@Slf4j
public class ExitMonitor implements SupervisedTask {

    static final String HOLDING_TIME = "holding time limit";
    static final String TAKE_PROFIT = "take profit";
    static final String STOP_LOSS = "stop loss";

    private static final Duration SUMMARY_INTERVAL = Duration.ofSeconds(30);

    private final TradingState state;
    private final QuoteSource quotes;
    private final OrderExecutor executor;
    private final HftProperties.Exit config;
    private final Clock clock;

    private Instant lastSummaryAt = Instant.EPOCH;

    public ExitMonitor(TradingState state, QuoteSource quotes, OrderExecutor executor, HftProperties.Exit config, Clock clock) {
        this.state = Objects.requireNonNull(state, "state");
        this.quotes = Objects.requireNonNull(quotes, "quotes");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String name() {
        return "exit-monitor";
    }

    @Override
    public void run() throws InterruptedException {
        Duration interval = Duration.ofMillis(config.checkIntervalMillis());
        while (!state.isShutdown()) {
            try {
                checkOnce(clock.instant());
            } catch (RuntimeException e) {
                log.error("EXIT: check failed: {}", e.toString(), e);
            }
            if (state.awaitShutdown(interval)) {
                return;
            }
        }
    }

    /**
     * Evaluates every active trade once and sells those that hit a rule.
     */
    public List<ExitDecision> checkOnce(Instant now) {
        Map<String, ActiveTrade> trades = state.getActiveTrades();
        if (!trades.isEmpty() && Duration.between(lastSummaryAt, now).compareTo(SUMMARY_INTERVAL) >= 0) {
            lastSummaryAt = now;
            log.info("EXIT: {} active trade(s)", trades.size());
        }
        List<ExitDecision> decisions = new ArrayList<>();
        for (ActiveTrade trade : trades.values()) {
            if (state.isShutdown()) {
                break;
            }
            Optional<ExitDecision> decision = evaluate(trade, now);
            if (decision.isEmpty()) {
                continue;
            }
            ExitDecision d = decision.get();
            log.info("EXIT: {} on {} | bid={} entry={} cash={} pct={}",
                    d.reason(), d.instrument(), d.bid(), trade.entryPrice(), d.cashPnl(), d.pctPnl());
            boolean sold = executor.placeSell(d.instrument(), d.reason());
            if (!sold) {
                log.warn("EXIT: {} sell for {} did not complete, retrying next cycle", d.reason(), d.instrument());
            }
            decisions.add(d.withExecuted(sold));
        }
        return decisions;
    }

    Optional<ExitDecision> evaluate(ActiveTrade trade, Instant now) {
        Optional<BigDecimal> bid = quotes.current(trade.instrument(), now)
                .flatMap(VenueQuote::bestBid)
                .map(DepthLevel::price);
        if (bid.isEmpty()) {
            log.debug("EXIT: no bid for {}", trade.instrument());
            return Optional.empty();
        }
        BigDecimal diff = bid.get().subtract(trade.entryPrice());
        BigDecimal cash = diff.multiply(trade.shares());
        double pct = trade.entryPrice().signum() == 0
                ? 0.0
                : diff.divide(trade.entryPrice(), MathContext.DECIMAL64).doubleValue();

        String reason = null;
        long heldSeconds = Duration.between(trade.entryTime(), now).getSeconds();
        if (heldSeconds > config.holdingTimeLimitSeconds()) {
            reason = HOLDING_TIME;
        } else if (cash.compareTo(config.takeProfitUsd()) >= 0 || pct >= config.takeProfitPct()) {
            reason = TAKE_PROFIT;
        } else if (cash.compareTo(config.stopLossUsd().negate()) <= 0 || pct <= -config.stopLossPct()) {
            reason = STOP_LOSS;
        }
        if (reason == null) {
            return Optional.empty();
        }
        return Optional.of(new ExitDecision(trade.instrument(), reason, bid.get(), cash, pct, false));
    }

    public record ExitDecision(String instrument, String reason, BigDecimal bid, BigDecimal cashPnl, double pctPnl,
                               boolean executed) {

        ExitDecision withExecuted(boolean value) {
            return new ExitDecision(instrument, reason, bid, cashPnl, pctPnl, value);
        }
    }
}
