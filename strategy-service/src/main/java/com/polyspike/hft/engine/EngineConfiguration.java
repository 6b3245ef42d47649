package com.polyspike.hft.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.execution.OrderExecutor;
import com.polyspike.hft.engine.state.TradingState;
import com.polyspike.hft.engine.supervisor.WorkerSupervisor;
import com.polyspike.hft.engine.venue.ClobVenueGateway;
import com.polyspike.hft.engine.venue.QuoteSource;
import com.polyspike.hft.engine.venue.VenueGateway;
import com.polyspike.hft.engine.watchlist.SimulatedPositionSeeder;
import com.polyspike.hft.engine.watchlist.WatchlistResolver;
import com.polyspike.hft.events.HftEventPublisher;
import com.polyspike.hft.polymarket.clob.PolymarketClobClient;
import com.polyspike.hft.polymarket.data.PolymarketDataApiClient;
import com.polyspike.hft.polymarket.gamma.PolymarketGammaClient;
import com.polyspike.hft.strategy.executor.ExecutorApiClient;
import com.polyspike.hft.strategy.metrics.StrategyMetricsService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration(proxyBeanMethods = false)
public class EngineConfiguration {

  @Bean
  public TradingState tradingState(HftProperties properties) {
    HftProperties.Engine engine = properties.engine();
    return new TradingState(engine.priceHistorySize(), engine.maxConcurrentTrades(),
        engine.simulation().startingBalanceUsd());
  }

  @Bean
  @ConditionalOnMissingBean(VenueGateway.class)
  public VenueGateway venueGateway(
      PolymarketClobClient clob,
      ExecutorApiClient executorApi,
      HftProperties properties,
      Clock clock
  ) {
    return new ClobVenueGateway(clob, executorApi, properties, clock);
  }

  @Bean
  public QuoteSource quoteSource(TradingState state, VenueGateway gateway, HftProperties properties) {
    return new QuoteSource(state, gateway, properties.engine().quoteCache());
  }

  @Bean
  public OrderExecutor orderExecutor(
      TradingState state,
      VenueGateway gateway,
      HftProperties properties,
      Clock clock,
      HftEventPublisher events,
      StrategyMetricsService metrics
  ) {
    return new OrderExecutor(state, gateway, properties, clock, events, metrics);
  }

  @Bean
  public WorkerSupervisor workerSupervisor(TradingState state, HftProperties properties) {
    return new WorkerSupervisor(state, properties.engine().supervisor());
  }

  @Bean
  public WatchlistResolver watchlistResolver(
      HftProperties properties,
      PolymarketGammaClient gamma,
      PolymarketClobClient clob,
      PolymarketDataApiClient dataApi,
      ObjectMapper objectMapper
  ) {
    return new WatchlistResolver(properties, gamma, clob, dataApi, objectMapper);
  }

  @Bean
  public SimulatedPositionSeeder simulatedPositionSeeder(HftProperties properties, ObjectMapper objectMapper) {
    return new SimulatedPositionSeeder(properties.engine().simulation(), objectMapper);
  }
}
