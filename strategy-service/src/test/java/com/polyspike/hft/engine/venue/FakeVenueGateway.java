package com.polyspike.hft.engine.venue;

import com.polyspike.hft.domain.OrderSide;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory venue: standing books per instrument, optionally preceded by scripted quote results and order acks.
 * Unscripted market orders fill completely at their limit price.
 */
public class FakeVenueGateway implements VenueGateway {

    private final Clock clock;
    private final Map<String, VenueQuote> books = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<QuoteResult> scriptedQuotes = new ConcurrentLinkedDeque<>();
    private final ConcurrentLinkedDeque<OrderAck> scriptedAcks = new ConcurrentLinkedDeque<>();
    private final List<VenueOrder> orders = new CopyOnWriteArrayList<>();
    private final AtomicInteger quoteCalls = new AtomicInteger();

    private volatile BigDecimal balance = BigDecimal.valueOf(1_000);
    private volatile CountDownLatch submitGate;
    private final CountDownLatch submitEntered = new CountDownLatch(1);

    public FakeVenueGateway(Clock clock) {
        this.clock = clock;
    }

    public void setBook(String instrument, List<DepthLevel> bids, List<DepthLevel> asks) {
        books.put(instrument, new VenueQuote(instrument, bids, asks, clock.instant()));
    }

    public void setTopOfBook(String instrument, String bid, String bidSize, String ask, String askSize) {
        setBook(instrument,
                List.of(new DepthLevel(new BigDecimal(bid), new BigDecimal(bidSize))),
                List.of(new DepthLevel(new BigDecimal(ask), new BigDecimal(askSize))));
    }

    public void scriptQuote(QuoteResult result) {
        scriptedQuotes.addLast(result);
    }

    public void scriptAck(OrderAck ack) {
        scriptedAcks.addLast(ack);
    }

    public void setBalance(BigDecimal balance) {
        this.balance = balance;
    }

    /**
     * Makes every order submission wait until the returned latch is released.
     */
    public CountDownLatch blockSubmissions() {
        CountDownLatch gate = new CountDownLatch(1);
        submitGate = gate;
        return gate;
    }

    public boolean awaitSubmission(long millis) throws InterruptedException {
        return submitEntered.await(millis, TimeUnit.MILLISECONDS);
    }

    public List<VenueOrder> orders() {
        return List.copyOf(orders);
    }

    public int quoteCalls() {
        return quoteCalls.get();
    }

    @Override
    public QuoteResult getQuote(String instrument) {
        quoteCalls.incrementAndGet();
        QuoteResult scripted = scriptedQuotes.pollFirst();
        if (scripted != null) {
            return scripted;
        }
        VenueQuote quote = books.get(instrument);
        return quote == null ? QuoteResult.noLiquidity("no book") : QuoteResult.ok(quote);
    }

    @Override
    public Map<String, QuoteResult> getQuotes(Collection<String> instruments) {
        Map<String, QuoteResult> out = new LinkedHashMap<>();
        for (String instrument : instruments) {
            VenueQuote quote = books.get(instrument);
            if (quote != null) {
                out.put(instrument, QuoteResult.ok(quote));
            }
        }
        return out;
    }

    @Override
    public OrderAck submitOrder(VenueOrder order) {
        orders.add(order);
        CountDownLatch gate = submitGate;
        if (gate != null) {
            submitEntered.countDown();
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OrderAck.unknown("interrupted");
            }
        }
        OrderAck scripted = scriptedAcks.pollFirst();
        if (scripted != null) {
            return scripted;
        }
        if (order.resting()) {
            return OrderAck.accepted("resting-" + orders.size());
        }
        BigDecimal filled = order.side() == OrderSide.BUY
                ? order.amount().divide(order.price(), 4, RoundingMode.DOWN)
                : order.amount();
        return OrderAck.filled(filled, "order-" + orders.size());
    }

    @Override
    public Optional<BigDecimal> getBalance() {
        return Optional.ofNullable(balance);
    }
}
