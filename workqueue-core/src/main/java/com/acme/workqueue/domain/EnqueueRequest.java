package com.acme.workqueue.domain;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * Arguments of an enqueue call. Null priority, scheduled time and retry budget fall back to the
 * configured defaults.
 */
@Getter
@Builder
public class EnqueueRequest {

  private final String type;
  private final String body;
  private final Integer priority;
  private final String correlationId;
  private final Instant scheduledAt;
  private final Integer maxRetries;
}
