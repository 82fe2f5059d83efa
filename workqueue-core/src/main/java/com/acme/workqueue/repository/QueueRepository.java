package com.acme.workqueue.repository;

import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.MessageStatus;
import com.acme.workqueue.domain.QueueName;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Active message store of all queues. Every state change is a conditional statement guarded on the
 * expected current state, so concurrent callers cannot both win the same transition.
 */
public interface QueueRepository {

  /** Insert a PENDING message and return its generated id */
  long insert(
      QueueName queue,
      String type,
      String body,
      int priority,
      String correlationId,
      Instant scheduledAt,
      int maxRetries,
      Instant createdAt);

  /**
   * Atomically claim the next eligible message: PENDING, scheduled at or before {@code now},
   * matching {@code typeFilter} when given, ordered by priority DESC, created_at ASC, id ASC.
   *
   * @return the claimed message in PROCESSING state, or empty when nothing is eligible
   */
  Optional<Message> claimNext(QueueName queue, String typeFilter, String claimantId, Instant now);

  Optional<Message> findById(QueueName queue, long id);

  List<Message> findByCorrelationId(QueueName queue, String correlationId);

  /**
   * PROCESSING -> COMPLETED. Returns false unless the message is PROCESSING and still held by
   * {@code claimantId}.
   */
  boolean markCompleted(QueueName queue, long id, String claimantId, Instant endedAt);

  /**
   * PROCESSING -> PENDING with retry_count incremented, claimant cleared and the next attempt
   * scheduled. Returns false unless the row is PROCESSING, held by {@code claimantId} and at
   * {@code expectedRetryCount}.
   */
  boolean reschedule(
      QueueName queue,
      long id,
      String claimantId,
      int expectedRetryCount,
      String error,
      Instant nextAttemptAt);

  /**
   * In one transaction, delete the PROCESSING row matching the snapshot's id, claimant and retry
   * count and archive it in the dead-letter store. Returns false (and changes nothing) when the
   * guard fails.
   */
  boolean moveToDeadLetter(Message snapshot, String reason, String error, Instant deadLetteredAt);

  /**
   * Return PROCESSING messages claimed before {@code claimedBefore} to PENDING in any queue.
   *
   * @return number of released messages
   */
  int releaseStuckClaims(Instant claimedBefore, String reason, Instant now);

  /** Active-store row counts per status; statuses without rows are absent. */
  Map<MessageStatus, Long> countByStatus(QueueName queue);

  /** Creation time of the oldest PENDING message */
  Optional<Instant> findOldestPendingCreatedAt(QueueName queue);

  /** Timing summary of messages completed at or after {@code since} */
  ProcessingSummary summarizeCompleted(QueueName queue, Instant since);
}
