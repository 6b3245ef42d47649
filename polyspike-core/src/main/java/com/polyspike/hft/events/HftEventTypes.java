package com.polyspike.hft.events;

import lombok.experimental.UtilityClass;

@UtilityClass
public class HftEventTypes {

  public static final String ENGINE_TRADE_OPENED = "engine.trade.opened";
  public static final String ENGINE_TRADE_CLOSED = "engine.trade.closed";
  public static final String ENGINE_ORDER_REJECTED = "engine.order.rejected";
  public static final String ENGINE_QUOTE_PLACED = "engine.quote.placed";
}
