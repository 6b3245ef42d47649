package com.polyspike.hft.polymarket.http;

import java.net.URI;

/**
 * The request never produced an HTTP answer (connect/read failure, timeout, interruption).
 * Whether a non-idempotent request took effect is unknown.
 */
public final class PolymarketTransportException extends RuntimeException {

  private final URI uri;

  public PolymarketTransportException(String message, URI uri, Throwable cause) {
    super(message + ": " + uri, cause);
    this.uri = uri;
  }

  public URI uri() {
    return uri;
  }
}
