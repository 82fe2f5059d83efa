package com.acme.workqueue.config;

import java.time.Duration;

/**
 * Settings of the stuck-claim reaper ({@code workqueue.reaper.*}). Off by default: without it a
 * message abandoned by a crashed consumer stays PROCESSING until an operator intervenes.
 */
public class ReaperConfig {

  private boolean enabled = false;
  private Duration leaseTimeout = Duration.ofMinutes(15);
  private Duration interval = Duration.ofMinutes(1);

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getLeaseTimeout() {
    return leaseTimeout;
  }

  public void setLeaseTimeout(Duration leaseTimeout) {
    this.leaseTimeout = leaseTimeout;
  }

  /** How often the reaper looks for expired claims. */
  public Duration getInterval() {
    return interval;
  }

  public void setInterval(Duration interval) {
    this.interval = interval;
  }
}
