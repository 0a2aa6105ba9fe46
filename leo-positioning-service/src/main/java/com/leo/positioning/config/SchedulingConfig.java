package com.leo.positioning.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Dedicated scheduler for the navigation cycle. A single thread guarantees that cycles never
 * overlap and that the engine's per-cycle state is only touched by one thread.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SchedulingConfig {

    public static final String NAVIGATION_SCHEDULER = "navigationTaskScheduler";

    private final NavigationProperties navigationProperties;

    @Bean(name = NAVIGATION_SCHEDULER)
    public ThreadPoolTaskScheduler navigationTaskScheduler() {
        NavigationProperties.Cycle cycle = navigationProperties.getCycle();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("nav-engine-");

        // Let the cycle in flight finish on shutdown
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(cycle.getShutdownTimeoutMs());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();

        log.info("Initialized navigation scheduler - interval: {}ms, shutdown timeout: {}ms",
            cycle.getIntervalMs(), cycle.getShutdownTimeoutMs());
        return scheduler;
    }
}
