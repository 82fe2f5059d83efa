package com.acme.workqueue.retry;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  @Nested
  @DisplayName("Delay calculation")
  class DelayTests {

    @Test
    @DisplayName("doubles the base for each retry")
    void exponentialDelays() {
      BackoffPolicy policy = BackoffPolicy.uncapped(Duration.ofSeconds(60));

      assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(60));
      assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(120));
      assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(240));
      assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(480));
    }

    @Test
    @DisplayName("delays never decrease across successive retries")
    void nonDecreasing() {
      BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(5), Duration.ofMinutes(10));

      Duration previous = Duration.ZERO;
      for (int retry = 1; retry <= 64; retry++) {
        Duration delay = policy.delayFor(retry);
        assertThat(delay).as("retry %d", retry).isGreaterThanOrEqualTo(previous);
        previous = delay;
      }
    }

    @Test
    @DisplayName("caps delays at the configured maximum")
    void capped() {
      BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(60), Duration.ofMinutes(5));

      assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMinutes(4));
      assertThat(policy.delayFor(4)).isEqualTo(Duration.ofMinutes(5));
      assertThat(policy.delayFor(1000)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("very large retry numbers do not overflow without a cap")
    void noOverflow() {
      BackoffPolicy policy = BackoffPolicy.uncapped(Duration.ofMillis(1));

      assertThat(policy.delayFor(Integer.MAX_VALUE)).isPositive();
    }
  }

  @Nested
  @DisplayName("Argument validation")
  class ValidationTests {

    @Test
    @DisplayName("retry numbers start at 1")
    void rejectsRetryZero() {
      BackoffPolicy policy = BackoffPolicy.uncapped(Duration.ofSeconds(1));

      assertThatThrownBy(() -> policy.delayFor(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("base must be positive")
    void rejectsNonPositiveBase() {
      assertThatThrownBy(() -> BackoffPolicy.uncapped(Duration.ZERO))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> BackoffPolicy.uncapped(Duration.ofSeconds(-1)))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> BackoffPolicy.uncapped(null))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("cap must not be below the base")
    void rejectsCapBelowBase() {
      assertThatThrownBy(() -> new BackoffPolicy(Duration.ofMinutes(1), Duration.ofSeconds(30)))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }
}
