package com.acme.workqueue.processor.config;

import com.acme.workqueue.config.ConsumerConfig;
import com.acme.workqueue.config.QueueConfig;
import com.acme.workqueue.config.ReaperConfig;
import com.acme.workqueue.handler.MessageHandlerRegistry;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final QueueConfig queueConfig;
  private final ConsumerConfig consumerConfig;
  private final ReaperConfig reaperConfig;
  private final MessageHandlerRegistry handlerRegistry;

  @Property(name = "micronaut.server.port", defaultValue = "8080")
  private int serverPort;

  @Property(name = "db.dialect", defaultValue = "H2")
  private String dialect;

  @Property(name = "datasources.default.url", defaultValue = "")
  private String datasourceUrl;

  @Property(name = "datasources.default.maximum-pool-size", defaultValue = "10")
  private int maxPoolSize;

  public ConfigurationLogger(
      QueueConfig queueConfig,
      ConsumerConfig consumerConfig,
      ReaperConfig reaperConfig,
      MessageHandlerRegistry handlerRegistry) {
    this.queueConfig = queueConfig;
    this.consumerConfig = consumerConfig;
    this.reaperConfig = reaperConfig;
    this.handlerRegistry = handlerRegistry;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");

    LOG.info("━━━ Server & Database ━━━");
    LOG.info("  Port:               {} (admin HTTP endpoint)", serverPort);
    LOG.info("  Dialect:            {} (selects the claim strategy)", dialect);
    LOG.info("  JDBC URL:           {}", datasourceUrl);
    LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
    LOG.info("");

    LOG.info("━━━ Queue Defaults ━━━");
    LOG.info("  Backoff Base:       {} (delay before the first retry, doubled per retry)", queueConfig.getBackoffBase());
    LOG.info("  Max Backoff:        {} (upper bound for any retry delay)", queueConfig.getMaxBackoff());
    LOG.info("  Default Priority:   {}", queueConfig.getDefaultPriority());
    LOG.info("  Default Retries:    {} (failures tolerated before dead-lettering)", queueConfig.getDefaultMaxRetries());
    LOG.info("  Stats Window:       {} (trailing window for throughput and percentiles)", queueConfig.getStatsWindow());
    LOG.info("");

    LOG.info("━━━ Consumer ━━━");
    LOG.info("  Consumer:           {}", consumerConfig.isEnabled() ? "ENABLED" : "DISABLED");
    LOG.info("  Queue:              {}", consumerConfig.getQueue());
    LOG.info("  Threads:            {}", consumerConfig.getThreads());
    LOG.info("  Poll Interval:      {} (idle sleep when nothing is eligible)", consumerConfig.getPollInterval());
    LOG.info("  Handlers:           {}", handlerRegistry.registeredTypes());
    LOG.info("");

    LOG.info("━━━ Stuck-Claim Reaper ━━━");
    LOG.info("  Reaper:             {}", reaperConfig.isEnabled() ? "ENABLED" : "DISABLED");
    LOG.info("  Lease Timeout:      {} (claims older than this return to PENDING)", reaperConfig.getLeaseTimeout());
    LOG.info("  Interval:           {}", reaperConfig.getInterval());
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
  }
}
