package com.leo.positioning.health;

import com.leo.positioning.catalog.SatelliteCatalogProvider;
import com.leo.positioning.service.NavigationCycleScheduler;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Liveness for the positioning service: UP whenever the context can answer, whatever the state of
 * the navigation cycle. Reports what the process is working from (catalog source and size) and
 * when the cycle was started, so a restart loop or an empty catalog shows up without a readiness
 * failure.
 */
@Component("serviceLiveness")
public class ServiceLivenessHealthIndicator implements HealthIndicator {

    static final String NOT_STARTED = "not started";

    private final SatelliteCatalogProvider catalogProvider;
    private final NavigationCycleScheduler scheduler;
    private final Clock clock;
    private final Instant contextStartedAt;

    public ServiceLivenessHealthIndicator(
            SatelliteCatalogProvider catalogProvider,
            NavigationCycleScheduler scheduler,
            Clock clock) {
        this.catalogProvider = catalogProvider;
        this.scheduler = scheduler;
        this.clock = clock;
        this.contextStartedAt = clock.instant();
    }

    @Override
    public Health health() {
        Instant engineStartedAt = scheduler.getStartedAt();

        return Health.up()
                .withDetail("contextStartedAt", contextStartedAt.toString())
                .withDetail("uptime", Duration.between(contextStartedAt, clock.instant()).toString())
                .withDetail("catalogSource", catalogProvider.getSourceLabel())
                .withDetail("catalogSize", catalogProvider.snapshot().size())
                .withDetail("engineStartedAt",
                    engineStartedAt == null ? NOT_STARTED : engineStartedAt.toString())
                .build();
    }
}
