package com.leo.positioning.health;

import com.leo.positioning.config.NavigationProperties;
import com.leo.positioning.dto.NavigationSnapshot;
import com.leo.positioning.service.NavigationCycleScheduler;
import com.leo.positioning.service.NavigationStateStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the navigation cycle.
 *
 * <p>The engine is UP while cycles keep completing. It is DOWN when the scheduler was stopped, was
 * never started, or has not completed a cycle within {@code stall-intervals} cycle intervals:
 *
 * <pre>
 *   stalled = now − (lastCycleCompletedAt ?: startedAt) &gt; stallIntervals · intervalMs
 * </pre>
 *
 * <p>Losing the fix does not make the engine unhealthy; the published status and mode are reported
 * as details instead.
 */
@Slf4j
@Component
public class NavigationEngineHealthIndicator implements HealthIndicator {

  private static final String REASON_DETAIL = "reason";
  private static final String STATUS_DETAIL = "status";
  private static final String MODE_DETAIL = "fixMode";
  private static final String SATELLITES_DETAIL = "satellitesListed";
  private static final String CYCLES_DETAIL = "cyclesCompleted";
  private static final String SINCE_LAST_CYCLE_DETAIL = "msSinceLastCycle";
  private static final String THRESHOLD_DETAIL = "stallThresholdMs";

  private final NavigationCycleScheduler scheduler;
  private final NavigationStateStore stateStore;
  private final Clock clock;
  private final long stallThresholdMs;

  @Autowired
  public NavigationEngineHealthIndicator(
      NavigationCycleScheduler scheduler,
      NavigationStateStore stateStore,
      NavigationProperties properties,
      Clock clock) {
    this(
        scheduler,
        stateStore,
        clock,
        properties.getCycle().getStallIntervals() * properties.getCycle().getIntervalMs());
  }

  public NavigationEngineHealthIndicator(
      NavigationCycleScheduler scheduler,
      NavigationStateStore stateStore,
      Clock clock,
      long stallThresholdMs) {
    this.scheduler = scheduler;
    this.stateStore = stateStore;
    this.clock = clock;
    this.stallThresholdMs = stallThresholdMs;
  }

  @Override
  public Health health() {
    NavigationSnapshot snapshot = stateStore.current();

    if (scheduler.isStopped()) {
      return withSnapshot(Health.down(), snapshot)
          .withDetail(REASON_DETAIL, "Navigation cycle has been stopped")
          .build();
    }
    if (!scheduler.isRunning()) {
      return withSnapshot(Health.down(), snapshot)
          .withDetail(REASON_DETAIL, "Navigation cycle has not been started")
          .build();
    }

    Instant reference = scheduler.getLastCycleCompletedAt();
    if (reference == null) {
      reference = scheduler.getStartedAt();
    }
    long sinceLast = reference == null ? 0L : Duration.between(reference, clock.instant()).toMillis();

    if (sinceLast > stallThresholdMs) {
      log.warn("Navigation cycle stalled: {}ms since last cycle (threshold {}ms)",
          sinceLast, stallThresholdMs);
      return withSnapshot(Health.down(), snapshot)
          .withDetail(REASON_DETAIL, "No navigation cycle completed within the stall threshold")
          .withDetail(SINCE_LAST_CYCLE_DETAIL, sinceLast)
          .withDetail(THRESHOLD_DETAIL, stallThresholdMs)
          .build();
    }

    return withSnapshot(Health.up(), snapshot)
        .withDetail(SINCE_LAST_CYCLE_DETAIL, sinceLast)
        .build();
  }

  private Health.Builder withSnapshot(Health.Builder builder, NavigationSnapshot snapshot) {
    return builder
        .withDetail(STATUS_DETAIL, snapshot.status())
        .withDetail(MODE_DETAIL, snapshot.fix().mode().getLabel())
        .withDetail(SATELLITES_DETAIL, snapshot.satellites().size())
        .withDetail(CYCLES_DETAIL, scheduler.getCyclesCompleted());
  }
}
