package com.acme.workqueue.domain;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Message row of a work queue (pure domain object, no persistence annotations). */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

  private long id;
  private String queueName;
  private String type;
  private String body;
  private int priority;
  private MessageStatus status;
  private String correlationId;
  private int retryCount;
  private int maxRetries;
  private Instant createdAt;
  private Instant scheduledAt;
  private Instant claimStartedAt;
  private Instant claimEndedAt;
  private String claimantId;
  private String lastError;

  /** A message can be claimed only while pending and once its scheduled time has passed. */
  public boolean isEligibleAt(Instant now) {
    return status == MessageStatus.PENDING && scheduledAt != null && !scheduledAt.isAfter(now);
  }

  /** Whether another failure would exhaust the retry budget. */
  public boolean isRetryBudgetExhausted() {
    return retryCount >= maxRetries;
  }
}
