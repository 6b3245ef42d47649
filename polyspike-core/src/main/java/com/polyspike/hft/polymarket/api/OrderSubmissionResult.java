package com.polyspike.hft.polymarket.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.polyspike.hft.config.HftProperties;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Executor answer to an order submission, carrying the raw CLOB response.
 */
public record OrderSubmissionResult(
    HftProperties.TradingMode mode,
    JsonNode clobResponse
) {

  public Optional<String> orderId() {
    return firstText("orderID", "orderId", "order_id");
  }

  public Optional<String> status() {
    return firstText("status").map(s -> s.trim().toLowerCase(Locale.ROOT));
  }

  public Optional<String> errorMessage() {
    return firstText("errorMsg", "error", "reason").filter(s -> !s.isBlank());
  }

  /**
   * Explicit {@code success} flag when present, otherwise derived from the order status.
   */
  public boolean accepted() {
    if (clobResponse == null || clobResponse.isNull()) {
      return false;
    }
    if (clobResponse.has("success")) {
      return clobResponse.get("success").asBoolean(false);
    }
    return status().map(s -> !s.contains("reject") && !s.contains("unmatched")).orElse(false);
  }

  /**
   * Shares exchanged by the order, if the response reports them.
   */
  public Optional<BigDecimal> filledShares(boolean buy) {
    Optional<BigDecimal> filledAmount = decimal("filledAmount");
    if (filledAmount.isPresent()) {
      return filledAmount;
    }
    // BUY: taking = shares received; SELL: making = shares given.
    return buy ? decimal("takingAmount") : decimal("makingAmount");
  }

  private Optional<String> firstText(String... fields) {
    if (clobResponse == null || clobResponse.isNull()) {
      return Optional.empty();
    }
    for (String f : fields) {
      JsonNode v = clobResponse.get(f);
      if (v != null && !v.isNull()) {
        return Optional.of(v.asText());
      }
    }
    return Optional.empty();
  }

  private Optional<BigDecimal> decimal(String field) {
    return firstText(field).flatMap(raw -> {
      try {
        return raw.isBlank() ? Optional.empty() : Optional.of(new BigDecimal(raw.trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    });
  }
}
