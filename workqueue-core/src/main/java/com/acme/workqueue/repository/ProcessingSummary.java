package com.acme.workqueue.repository;

/**
 * Aggregate over completed messages in a time window. Timing fields are null when the window
 * holds no completed message.
 */
public record ProcessingSummary(
    long completedCount, Double averageMillis, Double p50Millis, Double p95Millis) {

  public static ProcessingSummary empty() {
    return new ProcessingSummary(0, null, null, null);
  }
}
