package com.polyspike.hft.polymarket.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.polymarket.http.HttpRequestFactory;
import com.polyspike.hft.polymarket.http.PolymarketHttpTransport;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Data API: wallet positions with venue-computed PnL.
 */
@Slf4j
public final class PolymarketDataApiClient {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);
  private static final String POSITIONS = "/positions";

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final ObjectMapper objectMapper;

  public PolymarketDataApiClient(URI baseUri, PolymarketHttpTransport transport, ObjectMapper objectMapper) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public List<PolymarketPosition> getPositions(String userAddress, int limit, int offset) {
    HttpRequest request = requestFactory.request(POSITIONS, Map.of(
            "user", userAddress,
            "limit", Integer.toString(limit),
            "offset", Integer.toString(offset)))
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .build();
    JsonNode parsed = transport.sendJson(request, JsonNode.class);
    if (parsed == null || !parsed.isArray()) {
      log.warn("Unexpected data-api response type path={} user={} jsonType={}",
          POSITIONS, userAddress, parsed == null ? null : parsed.getNodeType());
      return List.of();
    }
    List<PolymarketPosition> positions = new ArrayList<>(parsed.size());
    for (JsonNode node : parsed) {
      try {
        positions.add(objectMapper.treeToValue(node, PolymarketPosition.class));
      } catch (Exception e) {
        log.warn("Skipping malformed position user={} error={}", userAddress, e.toString());
      }
    }
    return positions;
  }

  /**
   * Pages through every position of the wallet, stopping at the first short page or after {@code maxPages}.
   */
  public List<PolymarketPosition> getAllPositions(String userAddress, int pageSize, int maxPages) {
    List<PolymarketPosition> all = new ArrayList<>();
    for (int page = 0; page < Math.max(1, maxPages); page++) {
      List<PolymarketPosition> batch = getPositions(userAddress, pageSize, page * pageSize);
      all.addAll(batch);
      if (batch.size() < pageSize) {
        break;
      }
    }
    return all;
  }
}
