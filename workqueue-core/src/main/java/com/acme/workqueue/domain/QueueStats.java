package com.acme.workqueue.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time snapshot of a queue. Read without row locks, so it may lag concurrent claims and
 * completions slightly.
 *
 * @param queueName the queue
 * @param statusCounts messages per status; DEAD_LETTERED counts the dead-letter store
 * @param oldestPendingAgeSeconds age of the oldest pending message, null when none is pending
 * @param completedInWindow messages completed inside the trailing window
 * @param averageProcessingMillis mean claim-to-completion time in the window, null when none
 * @param p50ProcessingMillis median claim-to-completion time in the window, null when none
 * @param p95ProcessingMillis 95th percentile claim-to-completion time in the window, null when none
 * @param throughputPerMinute completed messages per minute over the window
 * @param window length of the trailing window
 * @param capturedAt when the snapshot was taken
 */
public record QueueStats(
    String queueName,
    Map<MessageStatus, Long> statusCounts,
    Long oldestPendingAgeSeconds,
    long completedInWindow,
    Double averageProcessingMillis,
    Double p50ProcessingMillis,
    Double p95ProcessingMillis,
    double throughputPerMinute,
    Duration window,
    Instant capturedAt) {

  public long count(MessageStatus status) {
    return statusCounts.getOrDefault(status, 0L);
  }
}
