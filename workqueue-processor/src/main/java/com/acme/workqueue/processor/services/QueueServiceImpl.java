package com.acme.workqueue.processor.services;

import com.acme.workqueue.config.QueueConfig;
import com.acme.workqueue.core.Jsons;
import com.acme.workqueue.core.ValidationException;
import com.acme.workqueue.domain.EnqueueRequest;
import com.acme.workqueue.domain.Message;
import com.acme.workqueue.domain.MessageStatus;
import com.acme.workqueue.domain.QueueName;
import com.acme.workqueue.domain.QueueStats;
import com.acme.workqueue.processor.CompletionHandler;
import com.acme.workqueue.repository.DeadLetterRepository;
import com.acme.workqueue.repository.ProcessingSummary;
import com.acme.workqueue.repository.QueueRepository;
import com.acme.workqueue.service.QueueService;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
public class QueueServiceImpl implements QueueService {
  private static final Logger LOG = LoggerFactory.getLogger(QueueServiceImpl.class);

  static final int MAX_TYPE_LENGTH = 100;
  static final int MAX_CORRELATION_ID_LENGTH = 128;
  static final int MAX_CLAIMANT_ID_LENGTH = 128;

  private final QueueRepository queueRepository;
  private final DeadLetterRepository deadLetterRepository;
  private final CompletionHandler completionHandler;
  private final QueueConfig config;
  private final Clock clock;

  public QueueServiceImpl(
      QueueRepository queueRepository,
      DeadLetterRepository deadLetterRepository,
      CompletionHandler completionHandler,
      QueueConfig config,
      Clock clock) {
    this.queueRepository = queueRepository;
    this.deadLetterRepository = deadLetterRepository;
    this.completionHandler = completionHandler;
    this.config = config;
    this.clock = clock;
  }

  @Override
  @Transactional
  public long enqueue(String queue, EnqueueRequest request) {
    QueueName name = QueueName.of(queue);
    if (request == null) {
      throw new ValidationException("Enqueue request is required");
    }
    String type = request.getType();
    if (type == null || type.isBlank()) {
      throw new ValidationException("Message type is required");
    }
    if (type.length() > MAX_TYPE_LENGTH) {
      throw new ValidationException(
          "Message type exceeds " + MAX_TYPE_LENGTH + " characters: " + type.length());
    }
    String correlationId = request.getCorrelationId();
    if (correlationId != null && correlationId.length() > MAX_CORRELATION_ID_LENGTH) {
      throw new ValidationException(
          "Correlation id exceeds "
              + MAX_CORRELATION_ID_LENGTH
              + " characters: "
              + correlationId.length());
    }
    if (request.getBody() == null || request.getBody().isEmpty()) {
      throw new ValidationException("Message body must not be empty");
    }
    int maxRetries =
        request.getMaxRetries() != null ? request.getMaxRetries() : config.getDefaultMaxRetries();
    if (maxRetries < 0) {
      throw new ValidationException("maxRetries must be >= 0, got " + maxRetries);
    }
    int priority =
        request.getPriority() != null ? request.getPriority() : config.getDefaultPriority();

    Instant now = clock.instant();
    Instant scheduledAt = request.getScheduledAt() != null ? request.getScheduledAt() : now;

    long id =
        queueRepository.insert(
            name,
            type,
            request.getBody(),
            priority,
            correlationId,
            scheduledAt,
            maxRetries,
            now);
    LOG.debug(
        "Enqueued message: queue={}, id={}, type={}, priority={}", name, id, type, priority);
    return id;
  }

  @Override
  public long enqueue(String queue, String type, String body) {
    return enqueue(queue, EnqueueRequest.builder().type(type).body(body).build());
  }

  @Override
  public long enqueueJson(String queue, String type, Object payload) {
    if (payload == null) {
      throw new ValidationException("Payload is required");
    }
    return enqueue(queue, type, Jsons.toJson(payload));
  }

  @Override
  @Transactional
  public Optional<Message> claim(String queue, String typeFilter, String claimantId) {
    QueueName name = QueueName.of(queue);
    String filter = typeFilter == null || typeFilter.isBlank() ? null : typeFilter;
    String claimant = claimantId == null || claimantId.isBlank() ? defaultClaimantId() : claimantId;
    if (claimant.length() > MAX_CLAIMANT_ID_LENGTH) {
      throw new ValidationException(
          "Claimant id exceeds " + MAX_CLAIMANT_ID_LENGTH + " characters: " + claimant.length());
    }
    return queueRepository.claimNext(name, filter, claimant, clock.instant());
  }

  @Override
  @Transactional
  public void complete(String queue, long messageId, boolean success, String errorMessage) {
    completionHandler.complete(QueueName.of(queue), messageId, success, errorMessage);
  }

  @Override
  @Transactional
  public void complete(
      String queue, long messageId, String claimantId, boolean success, String errorMessage) {
    completionHandler.complete(QueueName.of(queue), messageId, claimantId, success, errorMessage);
  }

  @Override
  @Transactional(readOnly = true)
  public QueueStats stats(String queue) {
    QueueName name = QueueName.of(queue);
    Instant now = clock.instant();
    Duration window = config.getStatsWindow();

    Map<MessageStatus, Long> counts = new EnumMap<>(MessageStatus.class);
    for (MessageStatus status : MessageStatus.values()) {
      counts.put(status, 0L);
    }
    counts.putAll(queueRepository.countByStatus(name));
    counts.put(MessageStatus.DEAD_LETTERED, deadLetterRepository.count(name));

    Long oldestPendingAge =
        queueRepository
            .findOldestPendingCreatedAt(name)
            .map(createdAt -> Math.max(0L, Duration.between(createdAt, now).getSeconds()))
            .orElse(null);

    ProcessingSummary summary = queueRepository.summarizeCompleted(name, now.minus(window));
    double throughput = (double) summary.completedCount() / config.getStatsWindowMinutes();

    return new QueueStats(
        name.value(),
        counts,
        oldestPendingAge,
        summary.completedCount(),
        summary.averageMillis(),
        summary.p50Millis(),
        summary.p95Millis(),
        throughput,
        window,
        now);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Message> findMessage(String queue, long messageId) {
    return queueRepository.findById(QueueName.of(queue), messageId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Message> findByCorrelationId(String queue, String correlationId) {
    if (correlationId == null || correlationId.isBlank()) {
      throw new ValidationException("Correlation id is required");
    }
    return queueRepository.findByCorrelationId(QueueName.of(queue), correlationId);
  }

  /** {@code <hostname>-<thread id>} of the calling thread, host name cut to fit the column. */
  static String defaultClaimantId() {
    String thread = "-" + Thread.currentThread().getId();
    String host = HostName.LOCAL;
    int room = MAX_CLAIMANT_ID_LENGTH - thread.length();
    return (host.length() > room ? host.substring(0, room) : host) + thread;
  }

  private static final class HostName {
    static final String LOCAL = resolve();

    private static String resolve() {
      try {
        return InetAddress.getLocalHost().getHostName();
      } catch (UnknownHostException e) {
        LOG.warn("Cannot resolve local host name, using 'localhost' for claimant ids", e);
        return "localhost";
      }
    }
  }
}
