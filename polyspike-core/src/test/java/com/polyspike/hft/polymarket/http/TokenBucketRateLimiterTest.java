package com.polyspike.hft.polymarket.http;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketRateLimiterTest {

  @Test
  void consumesBurstThenRefillsWithTime() {
    AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-01-01T00:00:00Z"));
    Clock clock = new Clock() {
      @Override
      public ZoneOffset getZone() {
        return ZoneOffset.UTC;
      }

      @Override
      public Clock withZone(ZoneId zone) {
        return this;
      }

      @Override
      public Instant instant() {
        return now.get();
      }
    };
    TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(10.0, 3, clock);

    limiter.acquire();
    limiter.acquire();
    limiter.acquire();
    assertThat(limiter.availableTokens()).isLessThan(1.0);

    now.set(now.get().plus(Duration.ofMillis(200)));
    assertThat(limiter.availableTokens()).isGreaterThanOrEqualTo(2.0);

    now.set(now.get().plus(Duration.ofSeconds(10)));
    assertThat(limiter.availableTokens()).isEqualTo(3.0);
  }

  @Test
  void rejectsNonPositiveConfiguration() {
    assertThatThrownBy(() -> new TokenBucketRateLimiter(0, 1, Clock.systemUTC()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TokenBucketRateLimiter(1, 0, Clock.systemUTC()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
