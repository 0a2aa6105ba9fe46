package com.leo.positioning.config;

import com.leo.positioning.dto.GeodeticCoordinate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the navigation engine.
 * Maps to the 'navigation' section in application.yml.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "navigation")
public class NavigationProperties {

    @Valid
    private Observer observer = new Observer();
    @Valid
    private Visibility visibility = new Visibility();
    @Valid
    private MeasurementModel measurement = new MeasurementModel();
    @Valid
    private Solver solver = new Solver();
    @Valid
    private PostProcessing postProcessing = new PostProcessing();
    @Valid
    private Cycle cycle = new Cycle();
    @Valid
    private Catalog catalog = new Catalog();
    @Valid
    private Publication publication = new Publication();
    @Valid
    private Spectrum spectrum = new Spectrum();

    /**
     * Reference receiver location. Measurements are synthesized against it and fix error is
     * scored against it; it never feeds the solver.
     */
    @Data
    public static class Observer {
        @DecimalMin(value = "-90.0", message = "Observer latitude must be at least -90 degrees")
        @DecimalMax(value = "90.0", message = "Observer latitude must be at most 90 degrees")
        private double latitudeDeg = 12.9706089;
        @DecimalMin(value = "-180.0", message = "Observer longitude must be at least -180 degrees")
        @DecimalMax(value = "180.0", message = "Observer longitude must be at most 180 degrees")
        private double longitudeDeg = 80.0431389;
        private double altitudeM = 45.0;

        public GeodeticCoordinate toCoordinate() {
            return new GeodeticCoordinate(latitudeDeg, longitudeDeg, altitudeM);
        }
    }

    @Data
    public static class Visibility {
        /** Satellites at or below this elevation are excluded. Negative values admit satellites below the horizon. */
        @DecimalMin(value = "-90.0", message = "Elevation mask must be at least -90 degrees")
        @DecimalMax(value = "90.0", message = "Elevation mask must be at most 90 degrees")
        private double elevationMaskDeg = 10.0;
    }

    @Data
    public static class MeasurementModel {
        @DecimalMin(value = "0.0", message = "Clock bias must be non-negative")
        private double clockBiasKm = 120.0;
        @DecimalMin(value = "0.0", message = "Noise bound must be non-negative")
        private double noiseBoundKm = 0.02;

        @AssertTrue(message = "Clock bias must not be smaller than the noise bound")
        public boolean isBiasCoveringNoise() {
            return clockBiasKm >= noiseBoundKm;
        }
    }

    @Data
    public static class Solver {
        @Min(value = 1, message = "Solver needs at least one iteration")
        private int maxIterations = 10;
        @DecimalMin(value = "0.0", inclusive = false, message = "Convergence threshold must be positive")
        private double convergenceThresholdKm = 1e-6;
        @DecimalMin(value = "1.0", inclusive = false, message = "Max condition number must exceed 1")
        private double maxConditionNumber = 1e10;
        @NotNull(message = "Initial guess strategy is required")
        private InitialGuess initialGuess = InitialGuess.PREVIOUS;
    }

    @Data
    public static class PostProcessing {
        /** 1.0 publishes the raw solver position; lower values pull toward the observer reference. */
        @DecimalMin(value = "0.0", message = "Blend weight must be at least 0")
        @DecimalMax(value = "1.0", message = "Blend weight must be at most 1")
        private double blendWeight = 1.0;
        @Valid
        private Smoothing smoothing = new Smoothing();

        @Data
        public static class Smoothing {
            private boolean enabled = true;
            @DecimalMin(value = "0.0", inclusive = false, message = "Smoothing alpha must be positive")
            @DecimalMax(value = "1.0", message = "Smoothing alpha must be at most 1")
            private double alpha = 0.3;
        }
    }

    @Data
    public static class Cycle {
        @Min(value = 1, message = "Cycle interval must be at least 1 ms")
        private long intervalMs = 1000;
        @Min(value = 0, message = "Shutdown timeout must be non-negative")
        private long shutdownTimeoutMs = 5000;
        @Min(value = 1, message = "Stall intervals must be at least 1")
        private int stallIntervals = 5;
        /** Start cycling once the application is ready. */
        private boolean autoStart = true;
    }

    @Data
    public static class Catalog {
        @Min(value = 1, message = "Max satellites must be at least 1")
        private int maxSatellites = 400;
        @NotBlank(message = "Catalog source label is required")
        private String source = "CONFIGURED";
        @Valid
        private List<Constellation> constellations = new ArrayList<>();

        @Data
        public static class Constellation {
            @NotBlank(message = "Constellation name is required")
            private String name;
            @Min(value = 1, message = "Constellation needs at least one plane")
            private int planes = 1;
            @Min(value = 1, message = "Constellation needs at least one satellite per plane")
            private int satellitesPerPlane = 1;
            @DecimalMin(value = "0.0", inclusive = false, message = "Orbit altitude must be positive")
            private double altitudeKm = 780.0;
            private double inclinationDeg = 86.4;
            /** Walker phasing factor F: relative phase offset between adjacent planes. */
            private int phasing = 1;
        }
    }

    @Data
    public static class Publication {
        @Min(value = 1, message = "At least one satellite must be listed")
        private int maxListedSatellites = 6;
        @Min(value = 1, message = "Event log capacity must be at least 1")
        private int logCapacity = 10;
    }

    @Data
    public static class Spectrum {
        @NotNull(message = "Spectrum mode is required")
        private SpectrumMode mode = SpectrumMode.SYNTHETIC;
        @Min(value = 1, message = "Spectrum needs at least one bin")
        private int bins = 40;
        @Min(value = 0, message = "Spectrum magnitudes must be non-negative")
        private int minMagnitude = 10;
        private int maxMagnitude = 50;
        private String livePath;
    }

    /** Where each Gauss-Newton solve starts. */
    public enum InitialGuess {
        ORIGIN,
        CENTROID,
        PREVIOUS
    }

    public enum SpectrumMode {
        SYNTHETIC,
        LIVE
    }
}
