package com.acme.workqueue.web;

import com.acme.workqueue.domain.EnqueueRequest;
import java.time.Instant;

/** Body of {@code POST /queues/{queue}/messages}; omitted fields take the configured defaults. */
public record EnqueueMessageRequest(
    String type,
    String body,
    Integer priority,
    String correlationId,
    Instant scheduledAt,
    Integer maxRetries) {

  EnqueueRequest toDomain() {
    return EnqueueRequest.builder()
        .type(type)
        .body(body)
        .priority(priority)
        .correlationId(correlationId)
        .scheduledAt(scheduledAt)
        .maxRetries(maxRetries)
        .build();
  }
}
