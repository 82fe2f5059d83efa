package com.acme.workqueue.config;

import java.time.Duration;

/** Settings of the in-process polling consumer ({@code workqueue.consumer.*}). */
public class ConsumerConfig {

  private boolean enabled = false;
  private String queue = "default";
  private String typeFilter;
  private int threads = 1;
  private Duration pollInterval = Duration.ofSeconds(1);
  private String claimantPrefix;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getQueue() {
    return queue;
  }

  public void setQueue(String queue) {
    this.queue = queue;
  }

  /** Only claim messages of this type; null claims any type. */
  public String getTypeFilter() {
    return typeFilter;
  }

  public void setTypeFilter(String typeFilter) {
    this.typeFilter = typeFilter;
  }

  public int getThreads() {
    return threads;
  }

  public void setThreads(int threads) {
    this.threads = threads;
  }

  /** How long an idle consumer thread sleeps when the queue had nothing eligible. */
  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public String getClaimantPrefix() {
    return claimantPrefix;
  }

  public void setClaimantPrefix(String claimantPrefix) {
    this.claimantPrefix = claimantPrefix;
  }
}
