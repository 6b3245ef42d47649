package com.polyspike.hft.strategy.web;

import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.EngineStatus;
import com.polyspike.hft.engine.PositionsSnapshot;
import com.polyspike.hft.engine.TradingEngine;
import com.polyspike.hft.engine.state.ActiveTrade;
import com.polyspike.hft.engine.state.TradingState;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/strategy")
@RequiredArgsConstructor
@Slf4j
public class StrategyStatusController {

  private final @NonNull HftProperties properties;
  private final @NonNull Environment environment;
  private final @NonNull TradingEngine engine;
  private final @NonNull TradingState state;

  @GetMapping("/status")
  public ResponseEntity<StrategyStatusResponse> status() {
    EngineStatus status = engine.status();
    return ResponseEntity.ok(new StrategyStatusResponse(
        status,
        environment.getActiveProfiles(),
        properties.executor().baseUrl(),
        properties.risk().killSwitch(),
        state.reservedTradeSlots(),
        state.inFlightOrderCount(),
        state.isInitialized()
    ));
  }

  @GetMapping("/positions")
  public ResponseEntity<PositionsSnapshot> positions() {
    return ResponseEntity.ok(engine.positionsSnapshot());
  }

  @GetMapping("/trades")
  public ResponseEntity<List<ActiveTrade>> trades() {
    return ResponseEntity.ok(List.copyOf(state.getActiveTrades().values()));
  }

  public record StrategyStatusResponse(EngineStatus engine, String[] activeProfiles, String executorBaseUrl,
                                       boolean killSwitch, int reservedTradeSlots, int inFlightOrders,
                                       boolean initialized) {
  }
}
