package com.polyspike.hft.polymarket.http;

import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with an upper bound, optional server-provided {@code retry-after}, and additive jitter.
 */
public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long initialBackoffMillis,
    long maxBackoffMillis,
    long maxJitterMillis
) {

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, 1, 0, 0, 0);
  }

  private static Long parseRetryAfterSeconds(String raw) {
    if (raw == null) {
      return null;
    }
    String t = raw.trim();
    if (t.isEmpty()) {
      return null;
    }
    try {
      return Long.parseLong(t);
    } catch (NumberFormatException ignored) {
      return null;
    }
  }

  public static boolean isRetryableStatus(int statusCode) {
    if (statusCode == 429 || statusCode == 408) {
      return true;
    }
    return statusCode >= 500 && statusCode <= 599;
  }

  public int attempts() {
    return enabled ? Math.max(1, maxAttempts) : 1;
  }

  /**
   * Delay before retry number {@code attempt} (1-based): {@code initial * 2^(attempt-1)}, capped.
   */
  public long computeDelayMillis(int attempt, Optional<String> retryAfterHeader) {
    if (retryAfterHeader != null && retryAfterHeader.isPresent()) {
      Long parsed = parseRetryAfterSeconds(retryAfterHeader.get());
      if (parsed != null && parsed > 0) {
        return Math.min(parsed * 1000L, Math.max(maxBackoffMillis, initialBackoffMillis));
      }
    }

    long base = Math.max(0, initialBackoffMillis);
    long max = Math.max(base, maxBackoffMillis);
    long delay = base;
    for (int i = 1; i < attempt; i++) {
      delay = Math.min(max, delay * 2);
    }
    return delay;
  }

  public long jitteredDelayMillis(int attempt, Optional<String> retryAfterHeader) {
    long delay = computeDelayMillis(attempt, retryAfterHeader);
    if (delay <= 0 || maxJitterMillis <= 0) {
      return delay;
    }
    return delay + ThreadLocalRandom.current().nextLong(0, maxJitterMillis + 1);
  }
}
