package com.acme.workqueue.web;

import com.acme.workqueue.domain.DeadLetterRecord;
import java.time.Instant;

public record DeadLetterView(
    long id,
    String queueName,
    long originalMessageId,
    String type,
    String body,
    int priority,
    String correlationId,
    int retryCount,
    int maxRetries,
    String lastError,
    String claimantId,
    Instant originalCreatedAt,
    String reason,
    Instant deadLetteredAt) {

  static DeadLetterView from(DeadLetterRecord r) {
    return new DeadLetterView(
        r.getId(),
        r.getQueueName(),
        r.getOriginalMessageId(),
        r.getType(),
        r.getBody(),
        r.getPriority(),
        r.getCorrelationId(),
        r.getRetryCount(),
        r.getMaxRetries(),
        r.getLastError(),
        r.getClaimantId(),
        r.getOriginalCreatedAt(),
        r.getReason(),
        r.getDeadLetteredAt());
  }
}
