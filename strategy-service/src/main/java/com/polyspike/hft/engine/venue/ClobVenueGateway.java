package com.polyspike.hft.engine.venue;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.polymarket.api.LimitOrderRequest;
import com.polyspike.hft.polymarket.api.MarketOrderRequest;
import com.polyspike.hft.polymarket.api.OrderSubmissionResult;
import com.polyspike.hft.polymarket.clob.PolymarketClobClient;
import com.polyspike.hft.polymarket.http.PolymarketDecodeException;
import com.polyspike.hft.polymarket.http.PolymarketHttpException;
import com.polyspike.hft.polymarket.http.PolymarketTransportException;
import com.polyspike.hft.polymarket.model.OrderBook;
import com.polyspike.hft.polymarket.model.OrderBookLevel;
import com.polyspike.hft.strategy.executor.ExecutorApiClient;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Venue backed by the public CLOB REST API for books and prices and by the executor service for orders and balance.
 */
@Slf4j
@RequiredArgsConstructor
public class ClobVenueGateway implements VenueGateway {

    private final @NonNull PolymarketClobClient clob;
    private final @NonNull ExecutorApiClient executorApi;
    private final @NonNull HftProperties properties;
    private final @NonNull Clock clock;

    @Override
    public QuoteResult getQuote(String instrument) {
        try {
            VenueQuote quote = toQuote(instrument, clob.getOrderBook(instrument));
            if (quote.isEmpty()) {
                quote = withPriceFallback(quote);
            }
            return quote.isEmpty()
                    ? QuoteResult.noLiquidity("empty book for " + instrument)
                    : QuoteResult.ok(quote);
        } catch (PolymarketHttpException e) {
            if (e.isNotFound()) {
                return QuoteResult.noLiquidity("no book for " + instrument);
            }
            return e.isTransient()
                    ? QuoteResult.transientFailure(e.getMessage())
                    : QuoteResult.invalid(e.getMessage());
        } catch (PolymarketTransportException e) {
            return QuoteResult.transientFailure(e.getMessage());
        } catch (PolymarketDecodeException e) {
            return QuoteResult.invalid(e.getMessage());
        } catch (IllegalStateException e) {
            // rate limiter interrupted
            return QuoteResult.transientFailure(e.getMessage());
        }
    }

    @Override
    public Map<String, QuoteResult> getQuotes(Collection<String> instruments) {
        Map<String, QuoteResult> out = new LinkedHashMap<>();
        if (instruments == null || instruments.isEmpty()) {
            return out;
        }
        List<OrderBook> books;
        try {
            books = clob.getOrderBooks(instruments);
        } catch (RuntimeException e) {
            log.debug("VENUE: batched book call failed for {} instruments: {}", instruments.size(), e.toString());
            return out;
        }
        for (OrderBook book : books) {
            if (book.assetId() == null || !instruments.contains(book.assetId())) {
                continue;
            }
            VenueQuote quote = toQuote(book.assetId(), book);
            if (!quote.isEmpty()) {
                out.put(book.assetId(), QuoteResult.ok(quote));
            }
        }
        return out;
    }

    @Override
    public OrderAck submitOrder(VenueOrder order) {
        try {
            OrderSubmissionResult result = order.resting()
                    ? executorApi.placeLimitOrder(new LimitOrderRequest(
                            order.instrument(), order.side(), order.price(), order.amount(), order.orderType()))
                    : executorApi.placeMarketOrder(new MarketOrderRequest(
                            order.instrument(), order.side(), order.amount(), order.price(), order.orderType()));
            return toAck(order, result);
        } catch (PolymarketHttpException e) {
            int status = e.statusCode();
            if (status == 429 || status == 503) {
                return OrderAck.transientFailure(e.getMessage());
            }
            if (status >= 400 && status < 500 && status != 408) {
                return OrderAck.rejected(e.getMessage());
            }
            return OrderAck.unknown(e.getMessage());
        } catch (PolymarketTransportException | PolymarketDecodeException e) {
            return OrderAck.unknown(e.getMessage());
        } catch (IllegalStateException e) {
            // rate limiter interrupted before sending
            return OrderAck.transientFailure(e.getMessage());
        }
    }

    @Override
    public Optional<BigDecimal> getBalance() {
        try {
            return Optional.ofNullable(executorApi.getAccount().usdcBalance());
        } catch (RuntimeException e) {
            log.warn("VENUE: balance unavailable: {}", e.toString());
            return Optional.empty();
        }
    }

    private OrderAck toAck(VenueOrder order, OrderSubmissionResult result) {
        if (result == null || !result.accepted()) {
            String reason = result == null ? "empty response" : result.errorMessage().orElse("not accepted");
            return OrderAck.rejected(reason);
        }
        String orderId = result.orderId().orElse(null);
        if (order.resting()) {
            return OrderAck.accepted(orderId);
        }
        boolean buy = order.side() == OrderSide.BUY;
        BigDecimal filled = result.filledShares(buy).orElseGet(() -> buy
                ? order.amount().divide(order.price(), 4, RoundingMode.DOWN)
                : order.amount());
        if (filled.signum() <= 0) {
            return OrderAck.rejected("accepted without fill");
        }
        return OrderAck.filled(filled, orderId);
    }

    private VenueQuote toQuote(String instrument, OrderBook book) {
        return new VenueQuote(instrument, toLevels(book.sortedBids()), toLevels(book.sortedAsks()), Instant.now(clock));
    }

    /**
     * Empty book: take each side from the price endpoint. Such levels carry no size.
     */
    private VenueQuote withPriceFallback(VenueQuote quote) {
        if (!Boolean.TRUE.equals(properties.engine().ingest().fallbackEnabled())) {
            return quote;
        }
        List<DepthLevel> bids = fallbackLevel(quote.instrument(), OrderSide.SELL);
        List<DepthLevel> asks = fallbackLevel(quote.instrument(), OrderSide.BUY);
        return new VenueQuote(quote.instrument(), bids, asks, quote.fetchedAt());
    }

    private List<DepthLevel> fallbackLevel(String instrument, OrderSide side) {
        try {
            return clob.getPrice(instrument, side)
                    .filter(p -> p.signum() > 0)
                    .map(p -> List.of(new DepthLevel(p, BigDecimal.ZERO)))
                    .orElse(List.of());
        } catch (PolymarketHttpException e) {
            if (e.isNotFound()) {
                return List.of();
            }
            throw e;
        }
    }

    private static List<DepthLevel> toLevels(List<OrderBookLevel> levels) {
        List<DepthLevel> out = new ArrayList<>(levels.size());
        for (OrderBookLevel level : levels) {
            if (level.price() == null || level.price().signum() <= 0) {
                continue;
            }
            out.add(new DepthLevel(level.price(), level.size()));
        }
        return out;
    }
}
