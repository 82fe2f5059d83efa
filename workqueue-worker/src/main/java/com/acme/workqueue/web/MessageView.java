package com.acme.workqueue.web;

import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.MessageStatus;
import java.time.Instant;

public record MessageView(
    long id,
    String queueName,
    String type,
    String body,
    int priority,
    MessageStatus status,
    String correlationId,
    int retryCount,
    int maxRetries,
    Instant createdAt,
    Instant scheduledAt,
    Instant claimStartedAt,
    Instant claimEndedAt,
    String claimantId,
    String lastError) {

  static MessageView from(Message m) {
    return new MessageView(
        m.getId(),
        m.getQueueName(),
        m.getType(),
        m.getBody(),
        m.getPriority(),
        m.getStatus(),
        m.getCorrelationId(),
        m.getRetryCount(),
        m.getMaxRetries(),
        m.getCreatedAt(),
        m.getScheduledAt(),
        m.getClaimStartedAt(),
        m.getClaimEndedAt(),
        m.getClaimantId(),
        m.getLastError());
  }
}
