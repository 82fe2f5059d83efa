package com.acme.workqueue.processor;

import com.acme.workqueue.core.InvalidStateException;
import com.acme.workqueue.domain.DeadLetterRecord;
import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.MessageStatus;
import com.acme.workqueue.domain.QueueName;
import com.acme.workqueue.repository.QueueRepository;
import com.acme.workqueue.retry.BackoffPolicy;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the outcome of processing a claimed message.
 *
 * <p>Success completes the message. A failure with retry budget left puts it back to PENDING,
 * scheduled after an exponential backoff; a failure with the budget spent moves it to the
 * dead-letter store. Every transition is a conditional update on the state and claimant observed
 * here, so a concurrent completion of the same claim makes exactly one caller win and the other
 * receive {@link InvalidStateException}. A caller that passes its own claimant id is also rejected
 * once its claim was released and taken over by another consumer.
 */
@Singleton
public class CompletionHandler {
  private static final Logger LOG = LoggerFactory.getLogger(CompletionHandler.class);

  private final QueueRepository repository;
  private final BackoffPolicy backoffPolicy;
  private final Clock clock;

  public CompletionHandler(QueueRepository repository, BackoffPolicy backoffPolicy, Clock clock) {
    this.repository = repository;
    this.backoffPolicy = backoffPolicy;
    this.clock = clock;
  }

  public void complete(QueueName queue, long messageId, boolean success, String errorMessage) {
    complete(queue, messageId, null, success, errorMessage);
  }

  /**
   * Record an outcome on behalf of {@code claimantId}; null accepts whichever claim is current.
   */
  public void complete(
      QueueName queue, long messageId, String claimantId, boolean success, String errorMessage) {
    Message message =
        repository
            .findById(queue, messageId)
            .orElseThrow(() -> rejected(queue, messageId, null));
    if (message.getStatus() != MessageStatus.PROCESSING) {
      throw rejected(queue, messageId, message.getStatus());
    }
    if (claimantId != null && !claimantId.equals(message.getClaimantId())) {
      throw claimLost(queue, messageId, claimantId);
    }

    Instant now = clock.instant();
    if (success) {
      if (!repository.markCompleted(queue, messageId, message.getClaimantId(), now)) {
        throw lostGuard(queue, message);
      }
      LOG.debug("Message completed: queue={}, id={}", queue, messageId);
    } else if (message.getRetryCount() < message.getMaxRetries()) {
      reschedule(queue, message, errorMessage, now);
    } else {
      deadLetter(queue, message, errorMessage, now);
    }
  }

  private void reschedule(QueueName queue, Message message, String errorMessage, Instant now) {
    int nextRetry = message.getRetryCount() + 1;
    Duration delay = backoffPolicy.delayFor(nextRetry);
    Instant nextAttemptAt = now.plus(delay);

    if (!repository.reschedule(
        queue,
        message.getId(),
        message.getClaimantId(),
        message.getRetryCount(),
        errorMessage,
        nextAttemptAt)) {
      throw lostGuard(queue, message);
    }
    LOG.info(
        "Message failed, retry {}/{} in {}: queue={}, id={}, error={}",
        nextRetry,
        message.getMaxRetries(),
        delay,
        queue,
        message.getId(),
        errorMessage);
  }

  private void deadLetter(QueueName queue, Message message, String errorMessage, Instant now) {
    if (!repository.moveToDeadLetter(
        message, DeadLetterRecord.REASON_MAX_RETRIES_EXCEEDED, errorMessage, now)) {
      throw lostGuard(queue, message);
    }
    LOG.warn(
        "Message dead-lettered after {} retries: queue={}, id={}, type={}, error={}",
        message.getRetryCount(),
        queue,
        message.getId(),
        message.getType(),
        errorMessage);
  }

  private InvalidStateException lostGuard(QueueName queue, Message observed) {
    MessageStatus current =
        repository.findById(queue, observed.getId()).map(Message::getStatus).orElse(null);
    if (current == MessageStatus.PROCESSING) {
      // released by the reaper and claimed again in between
      return claimLost(queue, observed.getId(), observed.getClaimantId());
    }
    return rejected(queue, observed.getId(), current);
  }

  private static InvalidStateException claimLost(
      QueueName queue, long messageId, String claimantId) {
    InvalidStateException e =
        InvalidStateException.claimLost(queue.value(), messageId, claimantId);
    LOG.warn("Completion rejected: {}", e.getMessage());
    return e;
  }

  private static InvalidStateException rejected(
      QueueName queue, long messageId, MessageStatus actual) {
    InvalidStateException e = InvalidStateException.notProcessing(queue.value(), messageId, actual);
    LOG.warn("Completion rejected: {}", e.getMessage());
    return e;
  }
}
