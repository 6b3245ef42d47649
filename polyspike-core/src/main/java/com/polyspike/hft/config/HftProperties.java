package com.polyspike.hft.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix = "hft")
public record HftProperties(
    TradingMode mode,
    @Valid Polymarket polymarket,
    @Valid Executor executor,
    @Valid Risk risk,
    @Valid Engine engine
) {

  public HftProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (polymarket == null) {
      polymarket = new Polymarket(null, null, null, null, null);
    }
    if (executor == null) {
      executor = new Executor(null, null);
    }
    if (risk == null) {
      risk = new Risk(false, null);
    }
    if (engine == null) {
      engine = defaultEngine();
    }
  }

  /**
   * PAPER runs every order against the in-memory simulated ledger; LIVE routes orders to the executor service.
   */
  public boolean simulation() {
    return mode == TradingMode.PAPER;
  }

  private static List<String> sanitizeStringList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .distinct()
        .toList();
  }

  private static Engine defaultEngine() {
    return new Engine(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  public enum TradingMode {
    PAPER,
    LIVE,
  }

  public enum LookbackMode {
    /**
     * Reference price is the tick immediately before the latest one.
     */
    PREVIOUS_TICK,
    /**
     * Reference price is the first of the last {@code lookbackSamples} points (0 = whole window).
     */
    SAMPLE_COUNT,
    /**
     * Reference price is the oldest point not older than {@code lookbackMillis}.
     */
    TIME_SPAN,
  }

  public enum WatchlistSource {
    CONFIG,
    SLUGS,
    POSITIONS,
  }

  public record Executor(
      String baseUrl,
      @NotNull Boolean sendLiveAck
  ) {
    public Executor {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "http://localhost:8080";
      }
      if (sendLiveAck == null) {
        sendLiveAck = true;
      }
    }
  }

  public record Polymarket(
      String clobRestUrl,
      String gammaUrl,
      String dataApiUrl,
      /**
       * Proxy wallet whose positions are polled in LIVE mode and in the POSITIONS watchlist source.
       */
      String userAddress,
      @Valid Rest rest
  ) {
    public Polymarket {
      if (clobRestUrl == null || clobRestUrl.isBlank()) {
        clobRestUrl = "https://clob.polymarket.com";
      }
      if (gammaUrl == null || gammaUrl.isBlank()) {
        gammaUrl = "https://gamma-api.polymarket.com";
      }
      if (dataApiUrl == null || dataApiUrl.isBlank()) {
        dataApiUrl = "https://data-api.polymarket.com";
      }
      if (userAddress == null) {
        userAddress = "";
      }
      if (rest == null) {
        rest = new Rest(null, null);
      }
    }
  }

  public record Rest(@Valid RateLimit rateLimit, @Valid Retry retry) {
    public Rest {
      if (rateLimit == null) {
        rateLimit = new RateLimit(null, null, null);
      }
      if (retry == null) {
        retry = new Retry(null, null, null, null);
      }
    }
  }

  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double requestsPerSecond,
      @NotNull @PositiveOrZero Integer burst
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (requestsPerSecond == null) {
        requestsPerSecond = 20.0;
      }
      if (burst == null) {
        burst = 50;
      }
    }
  }

  public record Retry(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 200L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 2_000L;
      }
    }
  }

  public record Risk(
      /**
       * Blocks every new entry while set. Exits keep running.
       */
      boolean killSwitch,
      /**
       * Hard cap on the USDC notional of a single buy. 0 disables the cap.
       */
      @NotNull @PositiveOrZero BigDecimal maxOrderNotionalUsd
  ) {
    public Risk {
      if (maxOrderNotionalUsd == null) {
        maxOrderNotionalUsd = BigDecimal.ZERO;
      }
    }
  }

  public record Engine(
      @NotNull Boolean enabled,
      @NotNull @Min(2) Integer priceHistorySize,
      @NotNull @Min(1) Integer maxConcurrentTrades,
      @Valid Trading trading,
      @Valid Spike spike,
      @Valid MeanReversion meanReversion,
      @Valid PairArbitrage pairArbitrage,
      @Valid MarketMaking marketMaking,
      @Valid Exit exit,
      @Valid Ingest ingest,
      @Valid QuoteCache quoteCache,
      @Valid Simulation simulation,
      @Valid Watchlist watchlist,
      @Valid Supervisor supervisor,
      @Valid Detector detector,
      @Valid Status status
  ) {
    public Engine {
      if (enabled == null) {
        enabled = true;
      }
      if (priceHistorySize == null) {
        priceHistorySize = 100;
      }
      if (maxConcurrentTrades == null) {
        maxConcurrentTrades = 3;
      }
      if (trading == null) {
        trading = new Trading(null, null, null, null, null, null, null, null, null, null, null);
      }
      if (spike == null) {
        spike = new Spike(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
      }
      if (meanReversion == null) {
        meanReversion = new MeanReversion(null, null, null, null, null);
      }
      if (pairArbitrage == null) {
        pairArbitrage = new PairArbitrage(null, null, null);
      }
      if (marketMaking == null) {
        marketMaking = new MarketMaking(null, null, null, null, null);
      }
      if (exit == null) {
        exit = new Exit(null, null, null, null, null, null, null);
      }
      if (ingest == null) {
        ingest = new Ingest(null, null, null, null, null);
      }
      if (quoteCache == null) {
        quoteCache = new QuoteCache(null, null);
      }
      if (simulation == null) {
        simulation = new Simulation(null, null, null, null);
      }
      if (watchlist == null) {
        watchlist = new Watchlist(null, null, null, null, null, null, null);
      }
      if (supervisor == null) {
        supervisor = new Supervisor(null, null, null, null);
      }
      if (detector == null) {
        detector = new Detector(null, null, null);
      }
      if (status == null) {
        status = new Status(null, null);
      }
    }
  }

  public record Trading(
      /**
       * Target USDC notional of a single entry.
       */
      @NotNull @PositiveOrZero BigDecimal tradeUnitUsd,
      /**
       * Maximum adverse move between the last observed price and the executable price.
       */
      @NotNull @PositiveOrZero BigDecimal slippageTolerance,
      /**
       * Minimum top-of-book notional (price x size) on the side being hit.
       */
      @NotNull @PositiveOrZero BigDecimal minLiquidityUsd,
      @NotNull @PositiveOrZero Long cooldownSeconds,
      /**
       * Shares left untouched when selling out of a position.
       */
      @NotNull @PositiveOrZero BigDecimal keepMinShares,
      @NotNull @PositiveOrZero BigDecimal minSellShares,
      /**
       * When set, an instrument (or its pair) that was bought once is never re-entered.
       */
      @NotNull Boolean singleEntryEnabled,
      @NotNull @Min(1) Integer maxRetries,
      @NotNull @PositiveOrZero Long retryBaseDelayMillis,
      @NotNull @PositiveOrZero Long retryMaxDelayMillis,
      @NotNull @PositiveOrZero Long retryJitterMillis
  ) {
    public Trading {
      if (tradeUnitUsd == null) {
        tradeUnitUsd = BigDecimal.valueOf(10);
      }
      if (slippageTolerance == null) {
        slippageTolerance = new BigDecimal("0.02");
      }
      if (minLiquidityUsd == null) {
        minLiquidityUsd = BigDecimal.valueOf(10);
      }
      if (cooldownSeconds == null) {
        cooldownSeconds = 60L;
      }
      if (keepMinShares == null) {
        keepMinShares = BigDecimal.ZERO;
      }
      if (minSellShares == null) {
        minSellShares = BigDecimal.ONE;
      }
      if (singleEntryEnabled == null) {
        singleEntryEnabled = false;
      }
      if (maxRetries == null) {
        maxRetries = 3;
      }
      if (retryBaseDelayMillis == null) {
        retryBaseDelayMillis = 1_000L;
      }
      if (retryMaxDelayMillis == null) {
        retryMaxDelayMillis = 8_000L;
      }
      if (retryJitterMillis == null) {
        retryJitterMillis = 250L;
      }
    }
  }

  public record Spike(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double threshold,
      /**
       * Threshold for upward moves. Falls back to {@code threshold}.
       */
      @NotNull @PositiveOrZero Double thresholdUp,
      /**
       * Threshold for downward moves. Falls back to {@code threshold}.
       */
      @NotNull @PositiveOrZero Double thresholdDown,
      @NotNull @PositiveOrZero @DecimalMax("1.0") BigDecimal priceLowerBound,
      @NotNull @PositiveOrZero @DecimalMax("1.0") BigDecimal priceUpperBound,
      @NotNull LookbackMode lookbackMode,
      @NotNull @Min(0) Integer lookbackSamples,
      @NotNull @PositiveOrZero Long lookbackMillis,
      /**
       * Latest point older than this is treated as stale. 0 disables the guard.
       */
      @NotNull @PositiveOrZero Long maxDataAgeMillis,
      @NotNull Boolean dynamicThresholdEnabled,
      @NotNull @PositiveOrZero Double volatilityCoefficient,
      @NotNull @Min(2) Integer volatilityWindow,
      @NotNull @PositiveOrZero Double spreadBuffer
  ) {
    public Spike {
      if (enabled == null) {
        enabled = true;
      }
      if (threshold == null) {
        threshold = 0.02;
      }
      if (thresholdUp == null) {
        thresholdUp = threshold;
      }
      if (thresholdDown == null) {
        thresholdDown = threshold;
      }
      if (priceLowerBound == null) {
        priceLowerBound = new BigDecimal("0.20");
      }
      if (priceUpperBound == null) {
        priceUpperBound = new BigDecimal("0.80");
      }
      if (lookbackMode == null) {
        lookbackMode = LookbackMode.SAMPLE_COUNT;
      }
      if (lookbackSamples == null) {
        lookbackSamples = 0;
      }
      if (lookbackMillis == null) {
        lookbackMillis = 60_000L;
      }
      if (maxDataAgeMillis == null) {
        maxDataAgeMillis = 30_000L;
      }
      if (dynamicThresholdEnabled == null) {
        dynamicThresholdEnabled = false;
      }
      if (volatilityCoefficient == null) {
        volatilityCoefficient = 2.0;
      }
      if (volatilityWindow == null) {
        volatilityWindow = 20;
      }
      if (spreadBuffer == null) {
        spreadBuffer = 0.005;
      }
    }
  }

  public record MeanReversion(
      @NotNull Boolean enabled,
      @NotNull @Min(3) Integer lookback,
      @NotNull @PositiveOrZero Double entryZ,
      @NotNull @PositiveOrZero Double exitZ,
      @NotNull @PositiveOrZero Long maxHoldSeconds
  ) {
    public MeanReversion {
      if (enabled == null) {
        enabled = false;
      }
      if (lookback == null) {
        lookback = 60;
      }
      if (entryZ == null) {
        entryZ = 1.5;
      }
      if (exitZ == null) {
        exitZ = 0.8;
      }
      if (maxHoldSeconds == null) {
        maxHoldSeconds = 600L;
      }
    }
  }

  public record PairArbitrage(
      @NotNull Boolean enabled,
      /**
       * Buy both legs when best ask A + best ask B falls below this sum.
       */
      @NotNull @PositiveOrZero BigDecimal entrySumThreshold,
      /**
       * Sell both legs once best bid A + best bid B exceeds the entry price sum by at least this edge.
       */
      @NotNull @PositiveOrZero BigDecimal exitMinEdge
  ) {
    public PairArbitrage {
      if (enabled == null) {
        enabled = false;
      }
      if (entrySumThreshold == null) {
        entrySumThreshold = new BigDecimal("0.995");
      }
      if (exitMinEdge == null) {
        exitMinEdge = BigDecimal.ZERO;
      }
    }
  }

  public record MarketMaking(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double spreadBps,
      /**
       * Quote size in shares.
       */
      @NotNull @PositiveOrZero BigDecimal orderSize,
      @NotNull @PositiveOrZero BigDecimal maxInventory,
      @NotNull @Min(1) Long refreshSeconds
  ) {
    public MarketMaking {
      if (enabled == null) {
        enabled = false;
      }
      if (spreadBps == null) {
        spreadBps = 50.0;
      }
      if (orderSize == null) {
        orderSize = BigDecimal.valueOf(10);
      }
      if (maxInventory == null) {
        maxInventory = BigDecimal.valueOf(100);
      }
      if (refreshSeconds == null) {
        refreshSeconds = 15L;
      }
    }
  }

  public record Exit(
      @NotNull Boolean enabled,
      @NotNull @Min(50) Long checkIntervalMillis,
      @NotNull @PositiveOrZero Long holdingTimeLimitSeconds,
      @NotNull @PositiveOrZero BigDecimal takeProfitUsd,
      @NotNull @PositiveOrZero Double takeProfitPct,
      /**
       * Positive magnitude; the trade closes once cash PnL is at or below {@code -stopLossUsd}.
       */
      @NotNull @PositiveOrZero BigDecimal stopLossUsd,
      @NotNull @PositiveOrZero Double stopLossPct
  ) {
    public Exit {
      if (enabled == null) {
        enabled = true;
      }
      if (checkIntervalMillis == null) {
        checkIntervalMillis = 1_000L;
      }
      if (holdingTimeLimitSeconds == null) {
        holdingTimeLimitSeconds = 3_600L;
      }
      if (takeProfitUsd == null) {
        takeProfitUsd = BigDecimal.valueOf(5);
      }
      if (takeProfitPct == null) {
        takeProfitPct = 0.10;
      }
      if (stopLossUsd == null) {
        stopLossUsd = BigDecimal.valueOf(5);
      }
      if (stopLossPct == null) {
        stopLossPct = 0.10;
      }
    }
  }

  public record Ingest(
      /**
       * Instruments polled per cycle, round-robin. 0 polls every instrument each cycle.
       */
      @NotNull @Min(0) Integer batchSize,
      @NotNull @Min(50) Long minIntervalMillis,
      @NotNull @Min(1) Integer parallelism,
      /**
       * Fall back to per-instrument book and price calls when the batched call misses a book.
       */
      @NotNull Boolean fallbackEnabled,
      @NotNull @Min(500) Long positionsRefreshMillis
  ) {
    public Ingest {
      if (batchSize == null) {
        batchSize = 20;
      }
      if (minIntervalMillis == null) {
        minIntervalMillis = 1_000L;
      }
      if (parallelism == null) {
        parallelism = 4;
      }
      if (fallbackEnabled == null) {
        fallbackEnabled = true;
      }
      if (positionsRefreshMillis == null) {
        positionsRefreshMillis = 5_000L;
      }
    }
  }

  public record QuoteCache(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Long ttlMillis
  ) {
    public QuoteCache {
      if (enabled == null) {
        enabled = true;
      }
      if (ttlMillis == null) {
        ttlMillis = 1_000L;
      }
    }
  }

  public record Simulation(
      @NotNull @PositiveOrZero BigDecimal startingBalanceUsd,
      @Valid List<SimulatedPosition> initialPositions,
      /**
       * Optional JSON file with initial positions (a list, or an object with a {@code positions} list).
       * Ignored when {@code initialPositions} is set.
       */
      String initialPositionsFile,
      /**
       * Pair the first two seeded positions sharing an event slug.
       */
      @NotNull Boolean autoPair
  ) {
    public Simulation {
      if (startingBalanceUsd == null) {
        startingBalanceUsd = BigDecimal.valueOf(10_000);
      }
      initialPositions = initialPositions == null
          ? List.of()
          : initialPositions.stream().filter(Objects::nonNull).toList();
      if (initialPositionsFile == null) {
        initialPositionsFile = "";
      }
      if (autoPair == null) {
        autoPair = true;
      }
    }
  }

  public record SimulatedPosition(
      String asset,
      BigDecimal shares,
      BigDecimal avgPrice,
      String eventSlug,
      String outcome
  ) {
  }

  public record Watchlist(
      @NotNull WatchlistSource source,
      /**
       * Explicit pairs in {@code tokenA:tokenB} form.
       */
      List<String> assetPairs,
      List<String> eventSlugs,
      /**
       * Optional JSON file with event slugs ({@code {"slugs": [...]}} or a plain list). Takes precedence over
       * {@code eventSlugs} when it yields at least one slug.
       */
      String eventSlugsFile,
      @NotNull Boolean requireOrderBook,
      @NotNull @Min(0) Integer maxPairs,
      @NotNull @PositiveOrZero Long initTimeoutSeconds
  ) {
    public Watchlist {
      if (source == null) {
        source = WatchlistSource.CONFIG;
      }
      assetPairs = sanitizeStringList(assetPairs);
      eventSlugs = sanitizeStringList(eventSlugs);
      if (eventSlugsFile == null) {
        eventSlugsFile = "";
      }
      if (requireOrderBook == null) {
        requireOrderBook = true;
      }
      if (maxPairs == null) {
        maxPairs = 50;
      }
      if (initTimeoutSeconds == null) {
        initTimeoutSeconds = 120L;
      }
    }
  }

  public record Supervisor(
      @NotNull @PositiveOrZero Long restartDelayMillis,
      @NotNull @Min(1) Integer maxConsecutiveFailures,
      @NotNull @PositiveOrZero Long escalationBackoffMillis,
      @NotNull @PositiveOrZero Long stopTimeoutMillis
  ) {
    public Supervisor {
      if (restartDelayMillis == null) {
        restartDelayMillis = 2_000L;
      }
      if (maxConsecutiveFailures == null) {
        maxConsecutiveFailures = 5;
      }
      if (escalationBackoffMillis == null) {
        escalationBackoffMillis = 30_000L;
      }
      if (stopTimeoutMillis == null) {
        stopTimeoutMillis = 10_000L;
      }
    }
  }

  public record Detector(
      @NotNull @Min(10) Long waitTimeoutMillis,
      @NotNull @Min(1) Integer dispatchThreads,
      @NotNull @Min(1) Integer dispatchQueueSize
  ) {
    public Detector {
      if (waitTimeoutMillis == null) {
        waitTimeoutMillis = 1_000L;
      }
      if (dispatchThreads == null) {
        dispatchThreads = 3;
      }
      if (dispatchQueueSize == null) {
        dispatchQueueSize = 100;
      }
    }
  }

  public record Status(
      @NotNull @Min(1_000) Long logIntervalMillis,
      @NotNull @Min(500) Long positionsLogIntervalMillis
  ) {
    public Status {
      if (logIntervalMillis == null) {
        logIntervalMillis = 30_000L;
      }
      if (positionsLogIntervalMillis == null) {
        positionsLogIntervalMillis = 2_000L;
      }
    }
  }
}
