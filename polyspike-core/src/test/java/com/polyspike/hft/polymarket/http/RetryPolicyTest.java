package com.polyspike.hft.polymarket.http;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

  private final RetryPolicy policy = new RetryPolicy(true, 4, 100, 350, 0);

  @Test
  void doublesDelayUpToTheCap() {
    assertThat(policy.computeDelayMillis(1, Optional.empty())).isEqualTo(100);
    assertThat(policy.computeDelayMillis(2, Optional.empty())).isEqualTo(200);
    assertThat(policy.computeDelayMillis(3, Optional.empty())).isEqualTo(350);
    assertThat(policy.computeDelayMillis(6, Optional.empty())).isEqualTo(350);
  }

  @Test
  void honoursRetryAfterButNeverBeyondTheCap() {
    assertThat(new RetryPolicy(true, 3, 100, 5_000, 0).computeDelayMillis(1, Optional.of("2"))).isEqualTo(2_000);
    assertThat(policy.computeDelayMillis(1, Optional.of("30"))).isEqualTo(350);
    assertThat(policy.computeDelayMillis(1, Optional.of("soon"))).isEqualTo(100);
  }

  @Test
  void jitterStaysWithinBound() {
    RetryPolicy jittered = new RetryPolicy(true, 3, 100, 1_000, 50);
    for (int i = 0; i < 100; i++) {
      assertThat(jittered.jitteredDelayMillis(1, Optional.empty())).isBetween(100L, 150L);
    }
  }

  @Test
  void disabledPolicyMakesASingleAttempt() {
    assertThat(RetryPolicy.disabled().attempts()).isEqualTo(1);
    assertThat(new RetryPolicy(false, 5, 100, 100, 0).attempts()).isEqualTo(1);
    assertThat(policy.attempts()).isEqualTo(4);
  }

  @Test
  void classifiesRetryableStatuses() {
    assertThat(RetryPolicy.isRetryableStatus(429)).isTrue();
    assertThat(RetryPolicy.isRetryableStatus(503)).isTrue();
    assertThat(RetryPolicy.isRetryableStatus(408)).isTrue();
    assertThat(RetryPolicy.isRetryableStatus(400)).isFalse();
    assertThat(RetryPolicy.isRetryableStatus(404)).isFalse();
  }
}
