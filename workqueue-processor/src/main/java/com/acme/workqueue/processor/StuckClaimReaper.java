package com.acme.workqueue.processor;

import com.acme.workqueue.config.ReaperConfig;
import com.acme.workqueue.repository.QueueRepository;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Returns messages whose claim outlived the lease timeout to PENDING so another consumer can take
 * them. The retry count is left alone: an abandoned claim is not a processing failure.
 */
@Singleton
@Requires(property = "workqueue.reaper.enabled", value = "true", defaultValue = "false")
public class StuckClaimReaper {
  private static final Logger LOG = LoggerFactory.getLogger(StuckClaimReaper.class);

  static final String LEASE_EXPIRED = "claim lease expired";

  private final QueueRepository repository;
  private final ReaperConfig config;
  private final Clock clock;

  public StuckClaimReaper(QueueRepository repository, ReaperConfig config, Clock clock) {
    this.repository = repository;
    this.config = config;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelay = "${workqueue.reaper.interval:1m}",
      initialDelay = "${workqueue.reaper.interval:1m}")
  public void tick() {
    try {
      reap();
    } catch (Exception e) {
      LOG.error("Error in StuckClaimReaper tick: {}", e.getMessage(), e);
    }
  }

  /** @return number of claims released */
  public int reap() {
    Instant now = clock.instant();
    int released =
        repository.releaseStuckClaims(now.minus(config.getLeaseTimeout()), LEASE_EXPIRED, now);
    if (released > 0) {
      LOG.warn(
          "Released {} claim(s) older than {}", released, config.getLeaseTimeout());
    }
    return released;
  }
}
