package com.polyspike.hft.engine;

import com.polyspike.hft.config.HftProperties;

import java.math.BigDecimal;

public record EngineStatus(
        HftProperties.TradingMode mode,
        boolean running,
        int activeTasks,
        int trackedInstruments,
        int activeTrades,
        BigDecimal simulatedBalance,
        long scans
) {
}
