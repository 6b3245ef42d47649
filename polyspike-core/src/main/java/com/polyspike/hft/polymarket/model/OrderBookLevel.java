package com.polyspike.hft.polymarket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderBookLevel(BigDecimal price, BigDecimal size) {

  public boolean isUsable() {
    return price != null && size != null && price.signum() > 0 && size.signum() > 0;
  }
}
