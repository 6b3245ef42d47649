package com.polyspike.hft.polymarket.http;

public interface RequestRateLimiter {

  /**
   * Blocks until one request may be sent.
   */
  void acquire();

  static RequestRateLimiter noop() {
    return () -> {
    };
  }
}
