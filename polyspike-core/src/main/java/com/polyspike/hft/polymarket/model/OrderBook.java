package com.polyspike.hft.polymarket.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CLOB order book snapshot. The venue does not guarantee level ordering, so the best levels are selected by price.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderBook(
    String market,
    @JsonProperty("asset_id") @JsonAlias("assetId") String assetId,
    String timestamp,
    String hash,
    @JsonAlias("buys") List<OrderBookLevel> bids,
    @JsonAlias("sells") List<OrderBookLevel> asks,
    @JsonProperty("tick_size") @JsonAlias("tickSize") BigDecimal tickSize
) {

  public OrderBook {
    bids = bids == null ? List.of() : bids.stream().filter(Objects::nonNull).toList();
    asks = asks == null ? List.of() : asks.stream().filter(Objects::nonNull).toList();
  }

  /**
   * Usable bid levels, best (highest) first.
   */
  public List<OrderBookLevel> sortedBids() {
    return bids.stream()
        .filter(OrderBookLevel::isUsable)
        .sorted(Comparator.comparing(OrderBookLevel::price).reversed())
        .toList();
  }

  /**
   * Usable ask levels, best (lowest) first.
   */
  public List<OrderBookLevel> sortedAsks() {
    return asks.stream()
        .filter(OrderBookLevel::isUsable)
        .sorted(Comparator.comparing(OrderBookLevel::price))
        .toList();
  }

  public Optional<OrderBookLevel> bestBid() {
    return sortedBids().stream().findFirst();
  }

  public Optional<OrderBookLevel> bestAsk() {
    return sortedAsks().stream().findFirst();
  }
}
