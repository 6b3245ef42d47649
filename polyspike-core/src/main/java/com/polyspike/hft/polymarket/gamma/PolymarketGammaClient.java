package com.polyspike.hft.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.polyspike.hft.polymarket.http.HttpRequestFactory;
import com.polyspike.hft.polymarket.http.PolymarketHttpTransport;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Gamma metadata API: events group markets, markets carry the outcome labels and CLOB token ids.
 */
public final class PolymarketGammaClient {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;

  public PolymarketGammaClient(URI baseUri, PolymarketHttpTransport transport) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  public JsonNode eventBySlug(String slug) {
    return getJsonNode(PolymarketGammaPaths.EVENT_BY_SLUG + "/" + HttpRequestFactory.pathSegment(slug), Map.of());
  }

  public JsonNode marketById(String id) {
    return getJsonNode(PolymarketGammaPaths.MARKETS + "/" + HttpRequestFactory.pathSegment(id), Map.of());
  }

  private JsonNode getJsonNode(String path, Map<String, String> query) {
    HttpRequest request = requestFactory.request(path, query)
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .header("User-Agent", "polyspike/1.0")
        .build();
    return transport.sendJson(request, JsonNode.class);
  }
}
