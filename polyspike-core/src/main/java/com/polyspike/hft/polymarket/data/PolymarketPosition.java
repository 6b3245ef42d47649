package com.polyspike.hft.polymarket.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PolymarketPosition(
    String proxyWallet,
    String asset,
    String conditionId,
    BigDecimal size,
    BigDecimal avgPrice,
    BigDecimal initialValue,
    BigDecimal currentValue,
    BigDecimal cashPnl,
    BigDecimal percentPnl,
    BigDecimal realizedPnl,
    BigDecimal curPrice,
    String title,
    String slug,
    String eventSlug,
    String outcome,
    Integer outcomeIndex,
    String oppositeOutcome,
    String oppositeAsset
) {

  /**
   * Grouping key: condition id, falling back to the event slug.
   */
  public String marketKey() {
    if (conditionId != null && !conditionId.isBlank()) {
      return conditionId;
    }
    return eventSlug;
  }
}
