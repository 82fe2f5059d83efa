package com.acme.workqueue.domain;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle status of a queued message */
public enum MessageStatus {
  /** Waiting to be claimed once its scheduled time has passed */
  PENDING,

  /** Claimed by exactly one consumer */
  PROCESSING,

  /** Processed successfully (terminal) */
  COMPLETED,

  /** Retries exhausted, moved to the dead-letter store (terminal) */
  DEAD_LETTERED;

  public boolean isTerminal() {
    return this == COMPLETED || this == DEAD_LETTERED;
  }

  /**
   * Whether the state machine allows moving from this status to {@code target}.
   *
   * <p>PENDING -> PROCESSING, and PROCESSING -> COMPLETED | PENDING | DEAD_LETTERED.
   */
  public boolean canTransitionTo(MessageStatus target) {
    return allowedTargets().contains(target);
  }

  private Set<MessageStatus> allowedTargets() {
    return switch (this) {
      case PENDING -> EnumSet.of(PROCESSING);
      case PROCESSING -> EnumSet.of(COMPLETED, PENDING, DEAD_LETTERED);
      case COMPLETED, DEAD_LETTERED -> EnumSet.noneOf(MessageStatus.class);
    };
  }
}
