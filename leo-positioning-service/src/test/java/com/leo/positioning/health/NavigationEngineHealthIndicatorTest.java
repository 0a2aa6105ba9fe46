package com.leo.positioning.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.leo.positioning.service.NavigationCycleScheduler;
import com.leo.positioning.service.NavigationStateStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@ExtendWith(MockitoExtension.class)
@DisplayName("Navigation Engine Health Indicator Tests")
class NavigationEngineHealthIndicatorTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  private static final long STALL_THRESHOLD_MS = 5000;

  @Mock private NavigationCycleScheduler scheduler;

  private NavigationEngineHealthIndicator indicator;

  @BeforeEach
  void setUp() {
    NavigationStateStore store = new NavigationStateStore(10, CLOCK);
    indicator = new NavigationEngineHealthIndicator(scheduler, store, CLOCK, STALL_THRESHOLD_MS);
  }

  @Test
  @DisplayName("should be UP while cycles complete within the stall threshold")
  void should_BeUp_When_CyclesRecent() {
    when(scheduler.isRunning()).thenReturn(true);
    when(scheduler.getLastCycleCompletedAt()).thenReturn(NOW.minusMillis(1200));
    when(scheduler.getCyclesCompleted()).thenReturn(42L);

    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("status", "BOOTING")
        .containsEntry("fixMode", "INIT")
        .containsEntry("satellitesListed", 0)
        .containsEntry("cyclesCompleted", 42L)
        .containsEntry("msSinceLastCycle", 1200L);
  }

  @Test
  @DisplayName("should be UP right after start before any cycle completes")
  void should_BeUp_When_JustStarted() {
    when(scheduler.isRunning()).thenReturn(true);
    when(scheduler.getLastCycleCompletedAt()).thenReturn(null);
    when(scheduler.getStartedAt()).thenReturn(NOW.minusMillis(300));

    assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
  }

  @Test
  @DisplayName("should be DOWN when no cycle completed within the stall threshold")
  void should_BeDown_When_Stalled() {
    when(scheduler.isRunning()).thenReturn(true);
    when(scheduler.getLastCycleCompletedAt()).thenReturn(NOW.minusMillis(8000));

    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsEntry("msSinceLastCycle", 8000L);
    assertThat(health.getDetails()).containsEntry("stallThresholdMs", STALL_THRESHOLD_MS);
  }

  @Test
  @DisplayName("should be DOWN once stopped")
  void should_BeDown_When_Stopped() {
    when(scheduler.isStopped()).thenReturn(true);

    Health health = indicator.health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsEntry("reason", "Navigation cycle has been stopped");
  }

  @Test
  @DisplayName("should be DOWN before the cycle has been started")
  void should_BeDown_When_NotStarted() {
    when(scheduler.isRunning()).thenReturn(false);

    assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
  }
}
