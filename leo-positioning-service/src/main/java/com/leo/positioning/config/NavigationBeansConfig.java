package com.leo.positioning.config;

import com.leo.positioning.catalog.CircularOrbitPropagator;
import com.leo.positioning.catalog.InMemorySatelliteCatalogProvider;
import com.leo.positioning.catalog.OrbitPropagator;
import com.leo.positioning.catalog.WalkerConstellationFactory;
import com.leo.positioning.dto.SatelliteDescriptor;
import com.leo.positioning.spectrum.FileSpectrumSource;
import com.leo.positioning.spectrum.SpectrumSource;
import com.leo.positioning.spectrum.SyntheticSpectrumSource;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the navigation engine's collaborators from {@link NavigationProperties}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class NavigationBeansConfig {

    private final NavigationProperties navigationProperties;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public Random random() {
        return new Random();
    }

    @Bean
    @ConditionalOnMissingBean
    public OrbitPropagator orbitPropagator() {
        return new CircularOrbitPropagator();
    }

    @Bean
    public InMemorySatelliteCatalogProvider satelliteCatalogProvider(Clock clock) {
        NavigationProperties.Catalog catalog = navigationProperties.getCatalog();
        List<SatelliteDescriptor> satellites =
            WalkerConstellationFactory.build(catalog.getConstellations(), clock.instant());
        log.info("Loaded {} satellites from {} constellations, source {}",
            satellites.size(), catalog.getConstellations().size(), catalog.getSource());
        return new InMemorySatelliteCatalogProvider(satellites, catalog.getSource());
    }

    /**
     * Selects the spectrum source by {@code navigation.spectrum.mode}.
     *
     * @throws IllegalStateException if LIVE mode is selected without a file path
     */
    @Bean
    public SpectrumSource spectrumSource(Random random) {
        NavigationProperties.Spectrum spectrum = navigationProperties.getSpectrum();
        switch (spectrum.getMode()) {
            case LIVE:
                if (spectrum.getLivePath() == null || spectrum.getLivePath().isBlank()) {
                    throw new IllegalStateException(
                        "navigation.spectrum.live-path is required when the spectrum mode is LIVE");
                }
                log.info("Using live spectrum file {}", spectrum.getLivePath());
                return new FileSpectrumSource(Path.of(spectrum.getLivePath()));
            case SYNTHETIC:
            default:
                return new SyntheticSpectrumSource(
                    random, spectrum.getBins(), spectrum.getMinMagnitude(), spectrum.getMaxMagnitude());
        }
    }
}
