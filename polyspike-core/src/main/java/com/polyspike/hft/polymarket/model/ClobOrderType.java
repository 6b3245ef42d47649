package com.polyspike.hft.polymarket.model;

public enum ClobOrderType {
  /**
   * Good-til-cancelled resting limit order.
   */
  GTC,
  /**
   * Fill-or-kill: the full amount fills immediately or nothing does.
   */
  FOK,
  /**
   * Fill-and-kill: whatever fills immediately, the rest is cancelled.
   */
  FAK,
}
