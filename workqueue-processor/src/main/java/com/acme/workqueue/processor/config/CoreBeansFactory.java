package com.acme.workqueue.processor.config;

import com.acme.workqueue.config.ConsumerConfig;
import com.acme.workqueue.config.QueueConfig;
import com.acme.workqueue.config.ReaperConfig;
import com.acme.workqueue.handler.MessageHandlerRegistry;
import com.acme.workqueue.retry.BackoffPolicy;
import com.acme.workqueue.spi.MessageHandler;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this module does the DI wiring.
 */
@Factory
public class CoreBeansFactory {

  /** Creates QueueConfig bean populated from application.yml workqueue.* properties */
  @Singleton
  @ConfigurationProperties("workqueue")
  public QueueConfig queueConfig() {
    return new QueueConfig();
  }

  /** Creates ConsumerConfig bean populated from workqueue.consumer.* properties */
  @Singleton
  @ConfigurationProperties("workqueue.consumer")
  public ConsumerConfig consumerConfig() {
    return new ConsumerConfig();
  }

  /** Creates ReaperConfig bean populated from workqueue.reaper.* properties */
  @Singleton
  @ConfigurationProperties("workqueue.reaper")
  public ReaperConfig reaperConfig() {
    return new ReaperConfig();
  }

  @Singleton
  public BackoffPolicy backoffPolicy(QueueConfig queueConfig) {
    return new BackoffPolicy(queueConfig.getBackoffBase(), queueConfig.getMaxBackoff());
  }

  /** Registers every MessageHandler bean; two handlers for one type fail startup. */
  @Singleton
  public MessageHandlerRegistry messageHandlerRegistry(List<MessageHandler> handlers) {
    MessageHandlerRegistry registry = new MessageHandlerRegistry();
    handlers.forEach(registry::register);
    return registry;
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }
}
