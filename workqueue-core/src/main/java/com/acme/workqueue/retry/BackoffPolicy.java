package com.acme.workqueue.retry;

import java.time.Duration;

/**
 * Exponential retry delay: {@code backoff(n) = base * 2^(n-1)} for the n-th retry, optionally
 * capped. Delays never decrease as n grows.
 */
public final class BackoffPolicy {

  // 2^30 * base already dwarfs any sensible cap
  private static final int MAX_EXPONENT = 30;

  private final Duration base;
  private final Duration maxDelay;

  /**
   * @param base delay before the first retry, must be positive
   * @param maxDelay upper bound for any delay, null for no cap
   */
  public BackoffPolicy(Duration base, Duration maxDelay) {
    if (base == null || base.isNegative() || base.isZero()) {
      throw new IllegalArgumentException("Backoff base must be positive: " + base);
    }
    if (maxDelay != null && maxDelay.compareTo(base) < 0) {
      throw new IllegalArgumentException(
          "Max backoff " + maxDelay + " is smaller than the base " + base);
    }
    this.base = base;
    this.maxDelay = maxDelay;
  }

  public static BackoffPolicy uncapped(Duration base) {
    return new BackoffPolicy(base, null);
  }

  /**
   * Delay before the given retry.
   *
   * @param retryNumber 1 for the first retry, 2 for the second, ...
   */
  public Duration delayFor(int retryNumber) {
    if (retryNumber < 1) {
      throw new IllegalArgumentException("Retry number starts at 1, got " + retryNumber);
    }
    int exponent = Math.min(retryNumber - 1, MAX_EXPONENT);
    Duration delay = base.multipliedBy(1L << exponent);
    if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
      return maxDelay;
    }
    return delay;
  }

  public Duration getBase() {
    return base;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }
}
