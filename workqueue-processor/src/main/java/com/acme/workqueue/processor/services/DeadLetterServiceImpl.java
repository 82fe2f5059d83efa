package com.acme.workqueue.processor.services;

import com.acme.workqueue.core.InvalidStateException;
import com.acme.workqueue.core.ValidationException;
import com.acme.workqueue.domain.DeadLetterRecord;
import com.acme.workqueue.domain.QueueName;
import com.acme.workqueue.repository.DeadLetterRepository;
import com.acme.workqueue.service.DeadLetterService;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class DeadLetterServiceImpl implements DeadLetterService {
  private static final Logger LOG = LoggerFactory.getLogger(DeadLetterServiceImpl.class);

  static final int MAX_LIST_LIMIT = 1000;

  private final DeadLetterRepository repository;
  private final Clock clock;

  public DeadLetterServiceImpl(DeadLetterRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  @Transactional(readOnly = true)
  public List<DeadLetterRecord> list(String queue, int limit) {
    QueueName name = QueueName.of(queue);
    if (limit < 1 || limit > MAX_LIST_LIMIT) {
      throw new ValidationException("limit must be between 1 and " + MAX_LIST_LIMIT + ", got " + limit);
    }
    return repository.findByQueue(name, limit);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<DeadLetterRecord> find(String queue, long deadLetterId) {
    return repository.findById(QueueName.of(queue), deadLetterId);
  }

  @Override
  @Transactional(readOnly = true)
  public long count(String queue) {
    return repository.count(QueueName.of(queue));
  }

  @Override
  @Transactional
  public long requeue(String queue, long deadLetterId) {
    QueueName name = QueueName.of(queue);
    long messageId =
        repository
            .requeue(name, deadLetterId, clock.instant())
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        name.value(),
                        deadLetterId,
                        null,
                        String.format(
                            "Dead-letter record %d not found in queue '%s'", deadLetterId, name)));
    LOG.info(
        "Requeued dead-letter record: queue={}, deadLetterId={}, messageId={}",
        name,
        deadLetterId,
        messageId);
    return messageId;
  }
}
