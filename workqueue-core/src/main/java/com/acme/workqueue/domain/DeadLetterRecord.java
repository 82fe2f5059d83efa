package com.acme.workqueue.domain;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable snapshot of a message whose retries ran out. Only the completion path creates these;
 * they leave the dead-letter store again only through an explicit operator requeue.
 */
@Getter
@Builder
@AllArgsConstructor
public class DeadLetterRecord {

  public static final String REASON_MAX_RETRIES_EXCEEDED = "max retries exceeded";

  private final long id;
  private final String queueName;
  private final long originalMessageId;
  private final String type;
  private final String body;
  private final int priority;
  private final String correlationId;
  private final int retryCount;
  private final int maxRetries;
  private final String lastError;
  private final String claimantId;
  private final Instant originalCreatedAt;
  private final String reason;
  private final Instant deadLetteredAt;

  /** Snapshot a processing message at the moment it is dead-lettered (id assigned on insert). */
  public static DeadLetterRecord of(
      Message message, String reason, String errorMessage, Instant deadLetteredAt) {
    return DeadLetterRecord.builder()
        .queueName(message.getQueueName())
        .originalMessageId(message.getId())
        .type(message.getType())
        .body(message.getBody())
        .priority(message.getPriority())
        .correlationId(message.getCorrelationId())
        .retryCount(message.getRetryCount())
        .maxRetries(message.getMaxRetries())
        .lastError(errorMessage != null ? errorMessage : message.getLastError())
        .claimantId(message.getClaimantId())
        .originalCreatedAt(message.getCreatedAt())
        .reason(reason)
        .deadLetteredAt(deadLetteredAt)
        .build();
  }
}
