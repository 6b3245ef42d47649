package com.polyspike.hft.polymarket.http;

import java.net.URI;

/**
 * A 2xx answer whose body does not have the expected shape.
 */
public final class PolymarketDecodeException extends RuntimeException {

  public PolymarketDecodeException(URI uri, Throwable cause) {
    super("Failed to decode JSON response from " + uri, cause);
  }
}
