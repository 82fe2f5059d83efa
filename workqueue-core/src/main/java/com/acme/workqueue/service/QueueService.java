package com.acme.workqueue.service;

import com.acme.workqueue.domain.EnqueueRequest;
import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.QueueStats;
import java.util.List;
import java.util.Optional;

/**
 * Producer and consumer facing operations of a work queue.
 *
 * <p>Queue names are validated on every call; an invalid name raises {@code ValidationException}.
 * Storage failures surface as {@code StorageException} and are never retried here.
 */
public interface QueueService {

  /**
   * Validate and persist a new PENDING message.
   *
   * @return the generated message id
   */
  long enqueue(String queue, EnqueueRequest request);

  /** Enqueue with default priority, schedule and retry budget */
  long enqueue(String queue, String type, String body);

  /** Serialize {@code payload} to JSON and enqueue it with defaults */
  long enqueueJson(String queue, String type, Object payload);

  /**
   * Atomically hand the next eligible message to {@code claimantId}.
   *
   * @param typeFilter only claim messages of this type, null for any
   * @param claimantId identity recorded on the claim, null for a host/thread default; at most 128
   *     characters
   * @return the claimed message, empty when nothing is eligible
   */
  Optional<Message> claim(String queue, String typeFilter, String claimantId);

  /**
   * Record the outcome of processing a claimed message. A failure is rescheduled with backoff, or
   * dead-lettered once the retry budget is spent; it is never rethrown.
   *
   * @throws com.acme.workqueue.core.InvalidStateException if the message is not PROCESSING
   */
  void complete(String queue, long messageId, boolean success, String errorMessage);

  /**
   * Same as {@link #complete(String, long, boolean, String)}, but only while the message is still
   * claimed by {@code claimantId}. A consumer whose claim expired and was taken over by another
   * claimant gets {@code InvalidStateException} instead of overwriting the new claim's outcome.
   */
  void complete(
      String queue, long messageId, String claimantId, boolean success, String errorMessage);

  QueueStats stats(String queue);

  Optional<Message> findMessage(String queue, long messageId);

  List<Message> findByCorrelationId(String queue, String correlationId);
}
