package com.leo.positioning.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.leo.positioning.config.NavigationProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
@DisplayName("Navigation Cycle Scheduler Tests")
class NavigationCycleSchedulerTest {

    private static final Clock CLOCK =
        Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Mock private NavigationEngine engine;
    @Mock private TaskScheduler taskScheduler;

    private SimpleMeterRegistry meterRegistry;
    private NavigationProperties properties;
    private NavigationStateStore store;
    private NavigationCycleScheduler scheduler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new NavigationProperties();
        properties.getCycle().setIntervalMs(250);
        properties.getCycle().setShutdownTimeoutMs(2000);
        store = new NavigationStateStore(properties, CLOCK);
        scheduler = new NavigationCycleScheduler(
            engine, store, taskScheduler, properties, meterRegistry, CLOCK);
    }

    private double noFixCount(String reason) {
        return meterRegistry.get("navigation.cycle.nofix").tag("reason", reason).counter().count();
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("should schedule the cycle at the configured fixed delay once")
        void should_ScheduleOnce_When_Started() {
            assertThat(scheduler.start()).isTrue();
            assertThat(scheduler.start()).isFalse();

            verify(taskScheduler, times(1))
                .scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMillis(250)));
            assertThat(scheduler.isRunning()).isTrue();
            assertThat(scheduler.getStartedAt()).isEqualTo(CLOCK.instant());
            assertThat(store.recentEvents()).containsExactly("[10:15:30] NAV: Engine started");
        }

        @Test
        @DisplayName("should not start when auto-start is disabled")
        void should_NotStart_When_AutoStartDisabled() {
            properties.getCycle().setAutoStart(false);

            scheduler.onApplicationReady();

            assertThat(scheduler.isRunning()).isFalse();
            verify(taskScheduler, never()).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        }

        @Test
        @DisplayName("should refuse to start or run cycles after stop")
        void should_IgnoreTriggers_When_Stopped() {
            scheduler.start();

            assertThat(scheduler.stop()).isTrue();

            assertThat(scheduler.isRunning()).isFalse();
            assertThat(scheduler.isStopped()).isTrue();
            assertThat(scheduler.start()).isFalse();
            assertThat(scheduler.tick()).isFalse();
            verify(engine, never()).runCycle();
        }
    }

    @Nested
    @DisplayName("Cycle Accounting")
    class AccountingTests {

        @Test
        @DisplayName("should count fixes and time each cycle")
        void should_CountFix_When_Tracking() {
            when(engine.runCycle()).thenReturn(CycleOutcome.TRACKING);

            assertThat(scheduler.tick()).isTrue();
            assertThat(scheduler.tick()).isTrue();

            assertThat(meterRegistry.get("navigation.cycle.fix").counter().count()).isEqualTo(2.0);
            assertThat(meterRegistry.get("navigation.cycle.duration").timer().count()).isEqualTo(2L);
            assertThat(scheduler.getCyclesCompleted()).isEqualTo(2L);
            assertThat(scheduler.getLastCycleCompletedAt()).isEqualTo(CLOCK.instant());
        }

        @Test
        @DisplayName("should count cycles without a fix by reason")
        void should_CountNoFixByReason() {
            when(engine.runCycle())
                .thenReturn(CycleOutcome.SEARCHING, CycleOutcome.ACQUIRING, CycleOutcome.SEARCHING);

            scheduler.tick();
            scheduler.tick();
            scheduler.tick();

            assertThat(noFixCount("searching")).isEqualTo(2.0);
            assertThat(noFixCount("acquiring")).isEqualTo(1.0);
            assertThat(meterRegistry.get("navigation.cycle.fix").counter().count()).isZero();
        }

        @Test
        @DisplayName("should count failed cycles as errors")
        void should_CountError_When_CycleFailed() {
            when(engine.runCycle()).thenReturn(CycleOutcome.FAILED);

            scheduler.tick();

            assertThat(noFixCount("failed")).isEqualTo(1.0);
            assertThat(meterRegistry.get("navigation.cycle.errors").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should survive an exception escaping the engine")
        void should_KeepRunning_When_EngineThrows() {
            when(engine.runCycle())
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(CycleOutcome.TRACKING);

            assertThat(scheduler.tick()).isTrue();
            assertThat(scheduler.tick()).isTrue();

            assertThat(meterRegistry.get("navigation.cycle.errors").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("navigation.cycle.fix").counter().count()).isEqualTo(1.0);
            assertThat(scheduler.getCyclesCompleted()).isEqualTo(2L);
        }
    }

    @Nested
    @DisplayName("Graceful Stop")
    class GracefulStopTests {

        @Test
        @DisplayName("should wait for the cycle in flight before returning")
        void should_WaitForInFlightCycle_When_Stopping() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(engine.runCycle()).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return CycleOutcome.TRACKING;
            });

            CompletableFuture<Boolean> inFlight = CompletableFuture.supplyAsync(scheduler::tick);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            CompletableFuture.runAsync(() -> {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                release.countDown();
            });

            boolean drained = scheduler.stop();

            assertThat(drained).isTrue();
            assertThat(inFlight.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(scheduler.getCyclesCompleted()).isEqualTo(1L);
        }

        @Test
        @DisplayName("should give up waiting after the shutdown timeout")
        void should_StopWaiting_When_TimeoutElapses() throws Exception {
            properties.getCycle().setShutdownTimeoutMs(100);
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(engine.runCycle()).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return CycleOutcome.TRACKING;
            });

            CompletableFuture<Boolean> inFlight = CompletableFuture.supplyAsync(scheduler::tick);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            boolean drained = scheduler.stop();
            release.countDown();

            assertThat(drained).isFalse();
            assertThat(inFlight.get(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("should skip a trigger while another cycle is in flight")
        void should_SkipOverlappingTrigger() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(engine.runCycle()).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return CycleOutcome.TRACKING;
            });

            CompletableFuture<Boolean> inFlight = CompletableFuture.supplyAsync(scheduler::tick);
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(scheduler.tick()).isFalse();
            release.countDown();
            assertThat(inFlight.get(5, TimeUnit.SECONDS)).isTrue();
            verify(engine, times(1)).runCycle();
        }
    }
}
