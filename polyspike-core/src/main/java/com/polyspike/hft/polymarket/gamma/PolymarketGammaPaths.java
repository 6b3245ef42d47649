package com.polyspike.hft.polymarket.gamma;

import lombok.experimental.UtilityClass;

@UtilityClass
public class PolymarketGammaPaths {

  public static final String MARKETS = "/markets";
  public static final String EVENT_BY_SLUG = "/events/slug";
}
