package com.acme.workqueue.config;

import java.time.Duration;

/**
 * Queue-wide defaults and retry settings. Pure POJO - no framework dependencies; bound from the
 * {@code workqueue.*} properties by the processor module.
 */
public class QueueConfig {

  private Duration backoffBase = Duration.ofSeconds(60);
  private Duration maxBackoff = Duration.ofHours(24);
  private int defaultPriority = 5;
  private int defaultMaxRetries = 3;
  private Duration statsWindow = Duration.ofHours(1);

  public Duration getBackoffBase() {
    return backoffBase;
  }

  public void setBackoffBase(Duration backoffBase) {
    this.backoffBase = backoffBase;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public int getDefaultPriority() {
    return defaultPriority;
  }

  public void setDefaultPriority(int defaultPriority) {
    this.defaultPriority = defaultPriority;
  }

  public int getDefaultMaxRetries() {
    return defaultMaxRetries;
  }

  public void setDefaultMaxRetries(int defaultMaxRetries) {
    this.defaultMaxRetries = defaultMaxRetries;
  }

  public Duration getStatsWindow() {
    return statsWindow;
  }

  public void setStatsWindow(Duration statsWindow) {
    this.statsWindow = statsWindow;
  }

  public long getStatsWindowMinutes() {
    return Math.max(1, statsWindow.toMinutes());
  }
}
