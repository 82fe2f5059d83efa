package com.acme.workqueue.processor;

import com.acme.workqueue.config.ConsumerConfig;
import com.acme.workqueue.core.InvalidStateException;
import com.acme.workqueue.domain.Message;
import com.acme.workqueue.handler.MessageHandlerRegistry;
import com.acme.workqueue.service.QueueService;
import com.acme.workqueue.spi.MessageHandler;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polling consumer for one queue: each thread claims a message, dispatches it to the handler
 * registered for its type and reports the outcome. A handler exception becomes a failed
 * completion carrying the exception message. Threads sleep for the poll interval whenever the queue
 * has nothing eligible.
 */
@Context
@Requires(property = "workqueue.consumer.enabled", value = "true", defaultValue = "false")
public class QueueConsumer {
  private static final Logger LOG = LoggerFactory.getLogger(QueueConsumer.class);

  private final QueueService queueService;
  private final MessageHandlerRegistry registry;
  private final ConsumerConfig config;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private ExecutorService executor;

  public QueueConsumer(
      QueueService queueService, MessageHandlerRegistry registry, ConsumerConfig config) {
    this.queueService = queueService;
    this.registry = registry;
    this.config = config;
  }

  @PostConstruct
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    int threads = Math.max(1, config.getThreads());
    AtomicInteger counter = new AtomicInteger();
    executor =
        Executors.newFixedThreadPool(
            threads,
            r -> {
              Thread t = new Thread(r, "queue-consumer-" + config.getQueue() + "-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    for (int i = 1; i <= threads; i++) {
      String claimantId = claimantIdFor(i);
      executor.submit(() -> pollLoop(claimantId));
    }
    LOG.info(
        "Queue consumer started: queue={}, threads={}, typeFilter={}, handlers={}",
        config.getQueue(),
        threads,
        config.getTypeFilter(),
        registry.registeredTypes());
  }

  @PreDestroy
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        LOG.warn("Queue consumer threads did not stop in time, interrupting");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    LOG.info("Queue consumer stopped: queue={}", config.getQueue());
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Claim and process at most one message.
   *
   * @return true when a message was claimed
   */
  public boolean pollOnce(String claimantId) {
    Optional<Message> claimed =
        queueService.claim(config.getQueue(), config.getTypeFilter(), claimantId);
    if (claimed.isEmpty()) {
      return false;
    }
    Message message = claimed.get();
    Optional<MessageHandler> handler = registry.find(message.getType());
    if (handler.isEmpty()) {
      LOG.warn("No handler for message: queue={}, id={}, type={}",
          message.getQueueName(), message.getId(), message.getType());
      report(message, false, "No handler registered for type " + message.getType());
      return true;
    }

    try {
      handler.get().handle(message);
      report(message, true, null);
    } catch (Exception e) {
      LOG.debug("Handler failed: queue={}, id={}", message.getQueueName(), message.getId(), e);
      report(message, false, describe(e));
    }
    return true;
  }

  private void pollLoop(String claimantId) {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      boolean worked;
      try {
        worked = pollOnce(claimantId);
      } catch (RuntimeException e) {
        LOG.error("Queue consumer poll failed: queue={}", config.getQueue(), e);
        worked = false;
      }
      if (!worked && !sleepQuietly()) {
        return;
      }
    }
  }

  private void report(Message message, boolean success, String error) {
    try {
      queueService.complete(
          message.getQueueName(), message.getId(), message.getClaimantId(), success, error);
    } catch (InvalidStateException e) {
      // claim was released by the reaper or completed elsewhere
      LOG.warn("Outcome not recorded: {}", e.getMessage());
    }
  }

  private boolean sleepQuietly() {
    try {
      Thread.sleep(config.getPollInterval().toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private String claimantIdFor(int index) {
    String prefix = config.getClaimantPrefix();
    return prefix == null || prefix.isBlank() ? null : prefix + "-" + index;
  }

  static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getName() : message;
  }
}
