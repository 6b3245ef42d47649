package com.polyspike.hft.engine;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.exit.ExitMonitor;
import com.polyspike.hft.engine.execution.OrderExecutor;
import com.polyspike.hft.engine.ingest.PositionRefresher;
import com.polyspike.hft.engine.ingest.PriceIngestor;
import com.polyspike.hft.engine.signal.MeanReversionStrategy;
import com.polyspike.hft.engine.signal.PairSumArbitrageStrategy;
import com.polyspike.hft.engine.signal.PassiveMarketMakingStrategy;
import com.polyspike.hft.engine.signal.SignalDetector;
import com.polyspike.hft.engine.signal.SignalStrategy;
import com.polyspike.hft.engine.signal.SpikeSignalStrategy;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.supervisor.WorkerSupervisor;
import com.polyspike.hft.engine.venue.QuoteSource;
import com.polyspike.hft.engine.venue.VenueGateway;
import com.polyspike.hft.engine.watchlist.SimulatedPositionSeeder;
import com.polyspike.hft.engine.watchlist.Watchlist;
import com.polyspike.hft.engine.watchlist.WatchlistResolver;
import com.polyspike.hft.polymarket.data.PolymarketDataApiClient;
import com.polyspike.hft.strategy.metrics.StrategyMetricsService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Owns the engine lifecycle: resolves the watchlist, registers the workers with the supervisor and stops them on
 * context shutdown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TradingEngine {

  private static final Duration WATCHLIST_RETRY_DELAY = Duration.ofSeconds(2);

  private final @NonNull HftProperties properties;
  private final @NonNull TradingState state;
  private final @NonNull WorkerSupervisor supervisor;
  private final @NonNull OrderExecutor executor;
  private final @NonNull VenueGateway gateway;
  private final @NonNull QuoteSource quoteSource;
  private final @NonNull WatchlistResolver watchlistResolver;
  private final @NonNull SimulatedPositionSeeder seeder;
  private final @NonNull PolymarketDataApiClient dataApi;
  private final @NonNull StrategyMetricsService metrics;
  private final @NonNull Clock clock;

  private volatile boolean running;
  private volatile Thread initThread;

  @PostConstruct
  void startIfEnabled() {
    if (!Boolean.TRUE.equals(properties.engine().enabled())) {
      log.info("STATE: engine disabled (hft.engine.enabled=false)");
      return;
    }
    Thread t = new Thread(() -> {
      try {
        initializeAndStart();
      } catch (RuntimeException e) {
        log.error("STATE: engine failed to start: {}", e.toString(), e);
      }
    }, "polyspike-init");
    t.setDaemon(true);
    initThread = t;
    t.start();
  }

  /**
   * Returns true once workers are running; false when there is nothing to track or shutdown intervened.
   */
  boolean initializeAndStart() {
    log.info("STATE: starting engine mode={} maxConcurrentTrades={}", properties.mode(),
        properties.engine().maxConcurrentTrades());

    Watchlist seeded = properties.simulation() ? seeder.seed(state) : Watchlist.EMPTY;
    Watchlist watchlist = resolveWatchlist().merge(seeded);
    watchlist.apply(state);
    if (state.trackedInstruments().isEmpty()) {
      log.error("STATE: no instruments to track, engine stays idle");
      return false;
    }
    if (state.isShutdown()) {
      return false;
    }
    state.markInitialized();

    for (SignalStrategy strategy : enabledStrategies()) {
      supervisor.register(new SignalDetector(strategy, state, executor, properties.engine().detector(), clock, metrics));
    }
    supervisor.register(new PriceIngestor(state, gateway, properties.engine(), clock));
    if (Boolean.TRUE.equals(properties.engine().exit().enabled())) {
      supervisor.register(new ExitMonitor(state, quoteSource, executor, properties.engine().exit(), clock));
    }
    String user = properties.polymarket().userAddress();
    if (!properties.simulation() && user != null && !user.isBlank()) {
      supervisor.register(new PositionRefresher(state, dataApi, user,
          Duration.ofMillis(properties.engine().ingest().positionsRefreshMillis())));
    }
    supervisor.register(new StatusReporter(state, this::status, properties.engine().status()));

    metrics.bindEngine(state, supervisor);
    metrics.updateBalance(state.simulatedBalance());
    supervisor.start();
    running = true;
    log.info("STATE: engine running | instruments={} pairs={} tasks={}",
        state.trackedInstruments().size(), watchlist.pairs().size(), supervisor.taskNames());
    return true;
  }

  private Watchlist resolveWatchlist() {
    Instant deadline = clock.instant().plusSeconds(properties.engine().watchlist().initTimeoutSeconds());
    while (!state.isShutdown()) {
      try {
        Watchlist resolved = watchlistResolver.resolve();
        if (!resolved.isEmpty()) {
          return resolved;
        }
      } catch (RuntimeException e) {
        log.warn("STATE: watchlist resolution failed: {}", e.toString());
      }
      if (!clock.instant().isBefore(deadline)) {
        log.warn("STATE: watchlist still empty after {}s", properties.engine().watchlist().initTimeoutSeconds());
        break;
      }
      try {
        if (state.awaitShutdown(WATCHLIST_RETRY_DELAY)) {
          break;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    return Watchlist.EMPTY;
  }

  List<SignalStrategy> enabledStrategies() {
    HftProperties.Engine engine = properties.engine();
    List<SignalStrategy> strategies = new ArrayList<>();
    if (Boolean.TRUE.equals(engine.spike().enabled())) {
      strategies.add(new SpikeSignalStrategy(engine));
    }
    if (Boolean.TRUE.equals(engine.meanReversion().enabled())) {
      strategies.add(new MeanReversionStrategy(engine));
    }
    if (Boolean.TRUE.equals(engine.pairArbitrage().enabled())) {
      strategies.add(new PairSumArbitrageStrategy(engine, quoteSource));
    }
    if (Boolean.TRUE.equals(engine.marketMaking().enabled())) {
      strategies.add(new PassiveMarketMakingStrategy(engine, quoteSource));
    }
    log.info("STATE: strategies enabled: {}",
        strategies.stream().map(SignalStrategy::name).collect(Collectors.joining(", ")));
    return strategies;
  }

  @PreDestroy
  public void stop() {
    Thread t = initThread;
    if (t != null && t.isAlive()) {
      state.requestShutdown();
      t.interrupt();
    }
    supervisor.stop();
    running = false;
  }

  public boolean isRunning() {
    return running;
  }

  public EngineStatus status() {
    TradingState.StateSnapshot snapshot = state.statusSnapshot();
    return new EngineStatus(
        properties.mode(),
        running,
        supervisor.activeTaskCount(),
        snapshot.trackedInstruments(),
        snapshot.activeTrades(),
        snapshot.simulatedBalance(),
        snapshot.scans()
    );
  }

  public PositionsSnapshot positionsSnapshot() {
    return PositionsSnapshot.capture(state);
  }
}
