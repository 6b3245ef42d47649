package com.polyspike.hft.engine.watchlist;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.state.InstrumentMeta;
import com.polyspike.hft.engine.state.TradingState;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the initial simulated holdings (inline config or a JSON file) into the simulated ledger.
 */
@Slf4j
@RequiredArgsConstructor
public class SimulatedPositionSeeder {

    private static final TypeReference<List<HftProperties.SimulatedPosition>> POSITION_LIST = new TypeReference<>() {
    };

    private final @NonNull HftProperties.Simulation config;
    private final @NonNull ObjectMapper objectMapper;

    /**
     * Seeds the state and returns the seeded instruments, paired by event slug when auto-pairing is on.
     */
    public Watchlist seed(TradingState state) {
        List<HftProperties.SimulatedPosition> positions = load();
        List<HftProperties.SimulatedPosition> valid = new ArrayList<>();
        for (HftProperties.SimulatedPosition p : positions) {
            if (p.asset() == null || p.asset().isBlank() || p.shares() == null || p.shares().signum() <= 0
                    || p.avgPrice() == null || p.avgPrice().signum() < 0) {
                log.warn("SIM: ignoring invalid initial position {}", p);
                continue;
            }
            state.upsertSimulatedPosition(p.asset(), p.shares(), p.avgPrice(), new InstrumentMeta(p.eventSlug(), p.outcome()));
            valid.add(p);
        }
        if (!valid.isEmpty()) {
            log.info("SIM: seeded {} initial position(s)", valid.size());
        }
        return toWatchlist(valid);
    }

    private Watchlist toWatchlist(List<HftProperties.SimulatedPosition> positions) {
        List<Watchlist.Pair> pairs = new ArrayList<>();
        List<Watchlist.Single> singles = new ArrayList<>();
        if (!Boolean.TRUE.equals(config.autoPair())) {
            positions.forEach(p -> singles.add(new Watchlist.Single(p.asset(), metaOf(p))));
            return new Watchlist(pairs, singles);
        }
        Map<String, List<HftProperties.SimulatedPosition>> bySlug = new LinkedHashMap<>();
        for (HftProperties.SimulatedPosition p : positions) {
            String key = p.eventSlug() == null || p.eventSlug().isBlank() ? "asset:" + p.asset() : p.eventSlug();
            bySlug.computeIfAbsent(key, k -> new ArrayList<>()).add(p);
        }
        for (List<HftProperties.SimulatedPosition> group : bySlug.values()) {
            int from = 0;
            if (group.size() >= 2) {
                HftProperties.SimulatedPosition a = group.get(0);
                HftProperties.SimulatedPosition b = group.get(1);
                pairs.add(new Watchlist.Pair(a.asset(), metaOf(a), b.asset(), metaOf(b)));
                from = 2;
            }
            for (int i = from; i < group.size(); i++) {
                singles.add(new Watchlist.Single(group.get(i).asset(), metaOf(group.get(i))));
            }
        }
        return new Watchlist(pairs, singles);
    }

    List<HftProperties.SimulatedPosition> load() {
        if (!config.initialPositions().isEmpty()) {
            return config.initialPositions();
        }
        if (config.initialPositionsFile().isBlank()) {
            return List.of();
        }
        Path path = Path.of(config.initialPositionsFile());
        try {
            JsonNode root = objectMapper.readTree(Files.readString(path));
            JsonNode list = root != null && root.has("positions") ? root.get("positions") : root;
            if (list == null || !list.isArray()) {
                log.warn("SIM: {} holds no position list", path);
                return List.of();
            }
            return objectMapper.convertValue(list, POSITION_LIST);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("SIM: cannot read initial positions from {}: {}", path, e.toString());
            return List.of();
        }
    }

    private static InstrumentMeta metaOf(HftProperties.SimulatedPosition p) {
        return new InstrumentMeta(p.eventSlug(), p.outcome());
    }
}
