package com.polyspike.hft.domain;

public enum OrderSide {
  BUY,
  SELL,
}
