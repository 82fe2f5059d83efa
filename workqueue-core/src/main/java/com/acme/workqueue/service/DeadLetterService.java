package com.acme.workqueue.service;

import com.acme.workqueue.domain.DeadLetterRecord;
import java.util.List;
import java.util.Optional;

/** Operator access to dead-lettered messages */
public interface DeadLetterService {

  List<DeadLetterRecord> list(String queue, int limit);

  Optional<DeadLetterRecord> find(String queue, long deadLetterId);

  long count(String queue);

  /**
   * Move a dead-lettered message back into its queue as a fresh PENDING message.
   *
   * @return id of the new message
   * @throws com.acme.workqueue.core.InvalidStateException if no such dead-letter record exists
   */
  long requeue(String queue, long deadLetterId);
}
