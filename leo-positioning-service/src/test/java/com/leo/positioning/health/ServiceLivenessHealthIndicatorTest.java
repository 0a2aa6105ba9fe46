package com.leo.positioning.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

import com.leo.positioning.catalog.OrbitalElements;
import com.leo.positioning.catalog.SatelliteCatalogProvider;
import com.leo.positioning.dto.SatelliteDescriptor;
import com.leo.positioning.service.NavigationCycleScheduler;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
@DisplayName("Service Liveness Health Indicator Tests")
class ServiceLivenessHealthIndicatorTest {

    private static final Instant STARTED = Instant.parse("2024-03-01T10:15:30Z");

    @Mock private SatelliteCatalogProvider catalogProvider;
    @Mock private NavigationCycleScheduler scheduler;

    private final MutableClock clock = new MutableClock(STARTED);
    private ServiceLivenessHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        when(catalogProvider.getSourceLabel()).thenReturn("CONFIGURED");
        when(catalogProvider.snapshot()).thenReturn(List.of(descriptor("A"), descriptor("B")));
        indicator = new ServiceLivenessHealthIndicator(catalogProvider, scheduler, clock);
    }

    @Test
    @DisplayName("should report UP with catalog details before the engine starts")
    void should_ReportUp_When_EngineNotStarted() {
        clock.advanceMillis(12_345);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("2024-03-01T10:15:30Z", health.getDetails().get("contextStartedAt"));
        assertEquals("PT12.345S", health.getDetails().get("uptime"));
        assertEquals("CONFIGURED", health.getDetails().get("catalogSource"));
        assertEquals(2, health.getDetails().get("catalogSize"));
        assertEquals(ServiceLivenessHealthIndicator.NOT_STARTED,
            health.getDetails().get("engineStartedAt"));
    }

    @Test
    @DisplayName("should stay UP and report the engine start time once the cycle runs")
    void should_ReportEngineStart_When_Started() {
        when(scheduler.getStartedAt()).thenReturn(STARTED.plusSeconds(2));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("2024-03-01T10:15:32Z", health.getDetails().get("engineStartedAt"));
    }

    private static SatelliteDescriptor descriptor(String id) {
        return new SatelliteDescriptor(id, null, "test", new OrbitalElements(1000, 0, 0, 0, STARTED));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advanceMillis(long millis) {
            now = now.plusMillis(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
