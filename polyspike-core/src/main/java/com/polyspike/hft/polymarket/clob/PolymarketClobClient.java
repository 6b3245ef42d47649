package com.polyspike.hft.polymarket.clob;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyspike.hft.domain.OrderSide;
import com.polyspike.hft.polymarket.http.HttpRequestFactory;
import com.polyspike.hft.polymarket.http.PolymarketDecodeException;
import com.polyspike.hft.polymarket.http.PolymarketHttpException;
import com.polyspike.hft.polymarket.http.PolymarketHttpTransport;
import com.polyspike.hft.polymarket.model.OrderBook;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Public (unauthenticated) CLOB market data: order books and executable prices.
 */
public final class PolymarketClobClient {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);
  private static final TypeReference<List<OrderBook>> ORDER_BOOK_LIST = new TypeReference<>() {
  };

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final ObjectMapper objectMapper;

  public PolymarketClobClient(URI baseUri, PolymarketHttpTransport transport, ObjectMapper objectMapper) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public OrderBook getOrderBook(String tokenId) {
    HttpRequest request = requestFactory.request(PolymarketClobPaths.BOOK, Map.of("token_id", tokenId))
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .build();
    return transport.sendJson(request, OrderBook.class);
  }

  /**
   * One round trip for many books. Books the venue does not know are simply absent from the result.
   */
  public List<OrderBook> getOrderBooks(Collection<String> tokenIds) {
    if (tokenIds == null || tokenIds.isEmpty()) {
      return List.of();
    }
    List<Map<String, String>> params = tokenIds.stream()
        .map(id -> Map.of("token_id", id))
        .toList();
    HttpRequest request = requestFactory.request(PolymarketClobPaths.BOOKS, Map.of())
        .POST(HttpRequest.BodyPublishers.ofString(writeJson(params)))
        .timeout(HTTP_TIMEOUT)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .build();
    List<OrderBook> books = transport.sendJson(request, ORDER_BOOK_LIST, true);
    return books == null ? List.of() : books;
  }

  /**
   * Executable price for taking the given side: BUY answers the price a buyer pays, SELL what a seller receives.
   */
  public Optional<BigDecimal> getPrice(String tokenId, OrderSide side) {
    HttpRequest request = requestFactory.request(
            PolymarketClobPaths.PRICE,
            Map.of("token_id", tokenId, "side", side.name()))
        .GET()
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .build();
    JsonNode node = transport.sendJson(request, JsonNode.class);
    JsonNode price = node == null ? null : node.get("price");
    if (price == null || price.isNull()) {
      return Optional.empty();
    }
    try {
      BigDecimal value = new BigDecimal(price.asText().trim());
      return value.signum() > 0 ? Optional.of(value) : Optional.empty();
    } catch (NumberFormatException e) {
      throw new PolymarketDecodeException(request.uri(), e);
    }
  }

  /**
   * False when the venue reports no book for the token (404) or the book has no usable level on either side.
   */
  public boolean hasOrderBook(String tokenId) {
    try {
      OrderBook book = getOrderBook(tokenId);
      return book.bestBid().isPresent() || book.bestAsk().isPresent();
    } catch (PolymarketHttpException e) {
      if (e.isNotFound()) {
        return false;
      }
      throw e;
    }
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to encode JSON", e);
    }
  }
}
