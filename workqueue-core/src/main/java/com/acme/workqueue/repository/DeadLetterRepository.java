package com.acme.workqueue.repository;

import com.acme.workqueue.domain.DeadLetterRecord;
import com.acme.workqueue.domain.QueueName;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/** Repository for the dead-letter store - archived messages waiting for manual intervention */
public interface DeadLetterRepository {

  /** Newest first */
  List<DeadLetterRecord> findByQueue(QueueName queue, int limit);

  Optional<DeadLetterRecord> findById(QueueName queue, long id);

  long count(QueueName queue);

  /**
   * In one transaction, insert a fresh PENDING message built from the record and delete the
   * record.
   *
   * @return id of the new message, empty when the record does not exist
   */
  OptionalLong requeue(QueueName queue, long deadLetterId, Instant now);
}
