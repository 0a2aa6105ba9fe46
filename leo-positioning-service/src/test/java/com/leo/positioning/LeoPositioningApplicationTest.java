package com.leo.positioning;

import static org.assertj.core.api.Assertions.assertThat;

import com.leo.positioning.catalog.InMemorySatelliteCatalogProvider;
import com.leo.positioning.dto.FixMode;
import com.leo.positioning.dto.NavigationSnapshot;
import com.leo.positioning.health.NavigationEngineHealthIndicator;
import com.leo.positioning.service.NavigationCycleScheduler;
import com.leo.positioning.service.NavigationEngine;
import com.leo.positioning.service.NavigationStateStore;
import com.leo.positioning.spectrum.SpectrumSource;
import com.leo.positioning.spectrum.SyntheticSpectrumSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/** Boots the full context with the test profile and drives one cycle by hand. */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
class LeoPositioningApplicationTest {

  @Autowired private NavigationCycleScheduler scheduler;
  @Autowired private NavigationStateStore stateStore;
  @Autowired private InMemorySatelliteCatalogProvider catalogProvider;
  @Autowired private SpectrumSource spectrumSource;
  @Autowired private NavigationEngine engine;
  @Autowired private NavigationEngineHealthIndicator engineHealth;

  @Test
  void contextLoadsWithConfiguredCatalog() {
    assertThat(catalogProvider.size()).isEqualTo(288);
    assertThat(catalogProvider.getSourceLabel()).isEqualTo("CONFIGURED");
    assertThat(spectrumSource).isInstanceOf(SyntheticSpectrumSource.class);
    assertThat(scheduler.isRunning()).isFalse();
  }

  @Test
  void engineAndItsHealthIndicatorAreSeparateBeans() {
    assertThat(engine).isNotNull();
    assertThat(engineHealth.health().getStatus()).isEqualTo(Status.DOWN);
    assertThat(engineHealth.health().getDetails())
        .containsEntry("reason", "Navigation cycle has not been started");
  }

  @Test
  void manualCyclePublishesLockedFix() {
    long before = stateStore.current().cycle();

    assertThat(scheduler.tick()).isTrue();

    NavigationSnapshot snapshot = stateStore.current();
    assertThat(snapshot.cycle()).isEqualTo(before + 1);
    assertThat(snapshot.status()).startsWith("TRACKING");
    assertThat(snapshot.fix().mode()).isEqualTo(FixMode.THREE_D_LOCK);
    assertThat(snapshot.fix().errorMeters()).isLessThan(1.0);
    assertThat(snapshot.spectrum()).hasSize(40);
    assertThat(snapshot.satellites()).isNotEmpty().hasSizeLessThanOrEqualTo(6);
  }
}
