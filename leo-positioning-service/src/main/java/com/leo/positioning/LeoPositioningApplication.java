package com.leo.positioning;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;

/**
 * Entry point for the LEO positioning service.
 *
 * <p>High-Level Steps: 1. Spring Boot auto-configuration and component scanning 2. Catalog,
 * propagator and spectrum source wiring from {@code navigation.*} properties 3. Health indicators
 * and metrics registration 4. Navigation cycle start on application ready
 */
@Slf4j
@SpringBootApplication
public class LeoPositioningApplication {

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(LeoPositioningApplication.class);

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(() -> log.info("Shutting down LEO Positioning Service gracefully...")));

    try {
      app.run(args);
    } catch (Exception e) {
      log.error("Failed to start LEO Positioning Service", e);
      System.exit(1);
    }
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady(ApplicationReadyEvent event) {
    Environment env = event.getApplicationContext().getEnvironment();

    log.info("=========================================");
    log.info("LEO Positioning Service Started Successfully");
    log.info("=========================================");
    log.info("Application Name: {}", env.getProperty("spring.application.name"));
    log.info("Server Port: {}", env.getProperty("server.port", "8080"));
    log.info("Observer: {}, {} ({} m)",
        env.getProperty("navigation.observer.latitude-deg"),
        env.getProperty("navigation.observer.longitude-deg"),
        env.getProperty("navigation.observer.altitude-m"));
    log.info("Elevation Mask: {} deg", env.getProperty("navigation.visibility.elevation-mask-deg"));
    log.info("Cycle Interval: {} ms", env.getProperty("navigation.cycle.interval-ms"));
    log.info("Spectrum Mode: {}", env.getProperty("navigation.spectrum.mode", "SYNTHETIC"));
    log.info(
        "Management Endpoints: {}", env.getProperty("management.endpoints.web.exposure.include"));
    log.info("=========================================");
  }
}
