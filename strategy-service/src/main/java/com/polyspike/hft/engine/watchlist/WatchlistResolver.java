package com.polyspike.hft.engine.watchlist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.config.HftProperties;
import com.polyspike.hft.engine.state.InstrumentMeta;
import com.polyspike.hft.polymarket.clob.PolymarketClobClient;
import com.polyspike.hft.polymarket.data.PolymarketDataApiClient;
import com.polyspike.hft.polymarket.data.PolymarketPosition;
import com.polyspike.hft.polymarket.discovery.OutcomeTokens;
import com.polyspike.hft.polymarket.discovery.PolymarketMarketParser;
import com.polyspike.hft.polymarket.gamma.PolymarketGammaClient;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the instruments to track from configured pairs, Gamma event slugs, or the wallet's live positions.
 * Markets that fail to resolve are skipped one by one.
 */
@Slf4j
@RequiredArgsConstructor
public class WatchlistResolver {

    private static final int POSITIONS_PAGE_SIZE = 500;
    private static final int POSITIONS_MAX_PAGES = 20;

    private final @NonNull HftProperties properties;
    private final @NonNull PolymarketGammaClient gamma;
    private final @NonNull PolymarketClobClient clob;
    private final @NonNull PolymarketDataApiClient dataApi;
    private final @NonNull ObjectMapper objectMapper;

    public Watchlist resolve() {
        HftProperties.Watchlist config = properties.engine().watchlist();
        Watchlist resolved = switch (config.source()) {
            case CONFIG -> fromConfigPairs(config.assetPairs()).merge(fromSlugs(eventSlugs(config)));
            case SLUGS -> fromSlugs(eventSlugs(config));
            case POSITIONS -> fromPositions();
        };
        Watchlist limited = limit(resolved, config.maxPairs());
        log.info("WATCHLIST: source={} pairs={} singles={}", config.source(), limited.pairs().size(), limited.singles().size());
        return limited;
    }

    Watchlist fromConfigPairs(List<String> assetPairs) {
        List<Watchlist.Pair> pairs = new ArrayList<>();
        for (String entry : assetPairs) {
            String[] parts = entry.split(":");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank() || parts[0].trim().equals(parts[1].trim())) {
                log.warn("WATCHLIST: ignoring malformed asset pair '{}', expected tokenA:tokenB", entry);
                continue;
            }
            String a = parts[0].trim();
            String b = parts[1].trim();
            if (!hasBooks(a, b)) {
                continue;
            }
            pairs.add(new Watchlist.Pair(a, InstrumentMeta.UNKNOWN, b, InstrumentMeta.UNKNOWN));
        }
        return new Watchlist(pairs, List.of());
    }

    Watchlist fromSlugs(List<String> slugs) {
        List<Watchlist.Pair> pairs = new ArrayList<>();
        for (String slug : slugs) {
            try {
                pairs.addAll(pairsForEvent(slug));
            } catch (RuntimeException e) {
                log.warn("WATCHLIST: event '{}' could not be resolved: {}", slug, e.toString());
            }
        }
        return new Watchlist(pairs, List.of());
    }

    private List<Watchlist.Pair> pairsForEvent(String slug) {
        JsonNode event = gamma.eventBySlug(slug);
        List<JsonNode> markets = PolymarketMarketParser.extractMarkets(event);
        if (markets.isEmpty() && event != null && event.isObject()) {
            markets = List.of(event);
        }
        List<Watchlist.Pair> pairs = new ArrayList<>();
        for (JsonNode market : markets) {
            try {
                if (!PolymarketMarketParser.isLive(market)) {
                    continue;
                }
                Optional<OutcomeTokens> tokens = tokensOf(market);
                if (tokens.isEmpty()) {
                    log.debug("WATCHLIST: no outcome tokens for market {} in '{}'", PolymarketMarketParser.id(market), slug);
                    continue;
                }
                OutcomeTokens t = tokens.get();
                if (!hasBooks(t.primaryTokenId(), t.pairedTokenId())) {
                    continue;
                }
                pairs.add(new Watchlist.Pair(
                        t.primaryTokenId(), new InstrumentMeta(slug, t.primaryOutcome()),
                        t.pairedTokenId(), new InstrumentMeta(slug, t.pairedOutcome())));
            } catch (RuntimeException e) {
                log.warn("WATCHLIST: skipping market {} in '{}': {}", PolymarketMarketParser.id(market), slug, e.toString());
            }
        }
        if (pairs.isEmpty()) {
            log.warn("WATCHLIST: event '{}' yielded no tradable markets", slug);
        }
        return pairs;
    }

    private Optional<OutcomeTokens> tokensOf(JsonNode market) {
        Optional<OutcomeTokens> tokens = PolymarketMarketParser.outcomeTokens(market, objectMapper);
        if (tokens.isPresent()) {
            return tokens;
        }
        String id = PolymarketMarketParser.id(market);
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return PolymarketMarketParser.outcomeTokens(gamma.marketById(id), objectMapper);
    }

    Watchlist fromPositions() {
        String user = properties.polymarket().userAddress();
        if (user == null || user.isBlank()) {
            throw new IllegalStateException("hft.polymarket.user-address is required for watchlist source POSITIONS");
        }
        List<PolymarketPosition> positions = dataApi.getAllPositions(user, POSITIONS_PAGE_SIZE, POSITIONS_MAX_PAGES);
        Map<String, List<PolymarketPosition>> byMarket = new LinkedHashMap<>();
        for (PolymarketPosition p : positions) {
            if (p.asset() == null || p.asset().isBlank()) {
                continue;
            }
            String key = p.marketKey() == null ? p.asset() : p.marketKey();
            byMarket.computeIfAbsent(key, k -> new ArrayList<>()).add(p);
        }

        List<Watchlist.Pair> pairs = new ArrayList<>();
        List<Watchlist.Single> singles = new ArrayList<>();
        for (List<PolymarketPosition> group : byMarket.values()) {
            if (group.size() > 1 && group.size() % 2 == 0) {
                PolymarketPosition a = group.get(0);
                PolymarketPosition b = group.get(1);
                pairs.add(new Watchlist.Pair(a.asset(), metaOf(a), b.asset(), metaOf(b)));
                continue;
            }
            for (PolymarketPosition p : group) {
                if (p.oppositeAsset() != null && !p.oppositeAsset().isBlank()) {
                    pairs.add(new Watchlist.Pair(p.asset(), metaOf(p), p.oppositeAsset(),
                            new InstrumentMeta(p.eventSlug(), p.oppositeOutcome())));
                } else {
                    singles.add(new Watchlist.Single(p.asset(), metaOf(p)));
                }
            }
        }
        return new Watchlist(pairs, singles);
    }

    /**
     * Slugs from {@code event-slugs-file} when it yields any, else the inline list.
     */
    List<String> eventSlugs(HftProperties.Watchlist config) {
        if (!config.eventSlugsFile().isBlank()) {
            List<String> fromFile = readSlugFile(Path.of(config.eventSlugsFile()));
            if (!fromFile.isEmpty()) {
                return fromFile;
            }
        }
        return config.eventSlugs();
    }

    private List<String> readSlugFile(Path path) {
        try {
            JsonNode root = objectMapper.readTree(Files.readString(path));
            JsonNode list = root != null && root.has("slugs") ? root.get("slugs") : root;
            List<String> out = new ArrayList<>();
            if (list != null && list.isArray()) {
                for (JsonNode n : list) {
                    String slug = n.asText("").trim();
                    if (!slug.isEmpty() && !out.contains(slug)) {
                        out.add(slug);
                    }
                }
            }
            return out;
        } catch (IOException e) {
            log.warn("WATCHLIST: cannot read slugs file {}: {}", path, e.toString());
            return List.of();
        }
    }

    private boolean hasBooks(String a, String b) {
        if (!Boolean.TRUE.equals(properties.engine().watchlist().requireOrderBook())) {
            return true;
        }
        try {
            if (clob.hasOrderBook(a) && clob.hasOrderBook(b)) {
                return true;
            }
            log.info("WATCHLIST: skipping {} / {}: no order book on one side", a, b);
            return false;
        } catch (RuntimeException e) {
            log.warn("WATCHLIST: order book check failed for {} / {}: {}", a, b, e.toString());
            return false;
        }
    }

    private static Watchlist limit(Watchlist watchlist, int maxPairs) {
        List<Watchlist.Pair> pairs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Watchlist.Pair pair : watchlist.pairs()) {
            if (maxPairs > 0 && pairs.size() >= maxPairs) {
                log.info("WATCHLIST: max-pairs {} reached, dropping the rest", maxPairs);
                break;
            }
            if (seen.contains(pair.first()) || seen.contains(pair.second())) {
                continue;
            }
            seen.add(pair.first());
            seen.add(pair.second());
            pairs.add(pair);
        }
        List<Watchlist.Single> singles = new ArrayList<>();
        for (Watchlist.Single single : watchlist.singles()) {
            if (seen.add(single.instrument())) {
                singles.add(single);
            }
        }
        return new Watchlist(pairs, singles);
    }

    private static InstrumentMeta metaOf(PolymarketPosition p) {
        return new InstrumentMeta(p.eventSlug(), p.outcome());
    }
}
