package com.leo.positioning.service;

import com.leo.positioning.algorithm.ExponentialFixSmoother;
import com.leo.positioning.algorithm.FixPostProcessor;
import com.leo.positioning.algorithm.MeasurementSynthesizer;
import com.leo.positioning.algorithm.PseudorangeSolver;
import com.leo.positioning.algorithm.PseudorangeSolver.Solution;
import com.leo.positioning.algorithm.VisibilityFilter;
import com.leo.positioning.algorithm.impl.GaussNewtonMultilaterationSolver;
import com.leo.positioning.algorithm.util.GeodeticTransform;
import com.leo.positioning.catalog.OrbitPropagator;
import com.leo.positioning.catalog.SatelliteCatalogProvider;
import com.leo.positioning.config.NavigationProperties;
import com.leo.positioning.dto.EcefCoordinate;
import com.leo.positioning.dto.Fix;
import com.leo.positioning.dto.FixMode;
import com.leo.positioning.dto.GeodeticCoordinate;
import com.leo.positioning.dto.LookAngles;
import com.leo.positioning.dto.Measurement;
import com.leo.positioning.dto.NavigationSnapshot;
import com.leo.positioning.dto.SatelliteDescriptor;
import com.leo.positioning.dto.SatelliteObservation;
import com.leo.positioning.dto.SolutionSummary;
import com.leo.positioning.dto.StateEstimate;
import com.leo.positioning.exception.PropagationException;
import com.leo.positioning.spectrum.SpectrumSource;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs navigation cycles: propagate the catalog, select visible satellites, synthesize
 * pseudoranges, solve, post-process and publish one snapshot.
 *
 * <p>Processing Steps:
 *
 * <ol>
 *   <li>Take one catalog snapshot, capped at the configured size
 *   <li>Propagate each satellite and keep those above the elevation mask; propagation failures
 *       skip the satellite
 *   <li>Synthesize one pseudorange per visible satellite against the configured observer
 *   <li>Solve with at least four measurements; otherwise keep the previous fix
 *   <li>Post-process and smooth the fix
 *   <li>Sample the spectrum and publish the snapshot
 * </ol>
 *
 * <p>{@link #runCycle()} is meant to be driven by a single thread and never throws.
 */
@Slf4j
@Service
public class NavigationEngine {

    // ============================================================================
    // CYCLE CONSTANTS
    // ============================================================================

    /** Speed of light in km/s, used to express pseudoranges as time of flight. */
    public static final double SPEED_OF_LIGHT_KM_S = 299_792.458;

    private static final double MILLIS_PER_SECOND = 1000.0;

    private final SatelliteCatalogProvider catalogProvider;
    private final OrbitPropagator propagator;
    private final VisibilityFilter visibilityFilter;
    private final MeasurementSynthesizer synthesizer;
    private final PseudorangeSolver solver;
    private final FixPostProcessor postProcessor;
    private final ExponentialFixSmoother smoother;
    private final SpectrumSource spectrumSource;
    private final NavigationStateStore stateStore;
    private final NavigationProperties properties;
    private final Clock clock;

    private final AtomicLong cycleCounter = new AtomicLong();
    private volatile StateEstimate lastEstimate;
    private volatile CycleOutcome lastOutcome;
    private volatile String lastCatalogDescription;

    public NavigationEngine(
            SatelliteCatalogProvider catalogProvider,
            OrbitPropagator propagator,
            VisibilityFilter visibilityFilter,
            MeasurementSynthesizer synthesizer,
            PseudorangeSolver solver,
            FixPostProcessor postProcessor,
            ExponentialFixSmoother smoother,
            SpectrumSource spectrumSource,
            NavigationStateStore stateStore,
            NavigationProperties properties,
            Clock clock) {
        this.catalogProvider = catalogProvider;
        this.propagator = propagator;
        this.visibilityFilter = visibilityFilter;
        this.synthesizer = synthesizer;
        this.solver = solver;
        this.postProcessor = postProcessor;
        this.smoother = smoother;
        this.spectrumSource = spectrumSource;
        this.stateStore = stateStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs one cycle and publishes its snapshot.
     *
     * @return how the cycle ended; {@link CycleOutcome#FAILED} if an unexpected error stopped it
     */
    public CycleOutcome runCycle() {
        try {
            return executeCycle();
        } catch (RuntimeException e) {
            log.error("Navigation cycle failed, keeping previous snapshot", e);
            recordTransition(CycleOutcome.FAILED);
            return CycleOutcome.FAILED;
        }
    }

    private CycleOutcome executeCycle() {
        Instant now = clock.instant();
        GeodeticCoordinate observer = properties.getObserver().toCoordinate();
        EcefCoordinate truth = GeodeticTransform.forward(observer);
        NavigationProperties.MeasurementModel model = properties.getMeasurement();

        List<SatelliteDescriptor> catalog = catalogProvider.snapshot();
        String source = catalogProvider.getSourceLabel();
        noteCatalog(catalog.size(), source);

        int limit = Math.min(catalog.size(), properties.getCatalog().getMaxSatellites());
        List<Measurement> measurements = new ArrayList<>();
        List<SatelliteObservation> observations = new ArrayList<>();
        int skipped = 0;

        for (SatelliteDescriptor satellite : catalog.subList(0, limit)) {
            EcefCoordinate position;
            LookAngles look;
            try {
                position = propagator.propagate(satellite, now);
                look = propagator.lookAngles(observer, position);
            } catch (PropagationException e) {
                log.warn("Skipping satellite {}: {}", satellite.id(), e.getMessage());
                skipped++;
                continue;
            } catch (RuntimeException e) {
                log.warn("Skipping satellite {} after unexpected propagation error", satellite.id(), e);
                skipped++;
                continue;
            }

            if (!visibilityFilter.isVisible(look.elevationDeg())) {
                continue;
            }

            Measurement measurement = synthesizer.synthesize(
                position, truth, model.getClockBiasKm(), model.getNoiseBoundKm());
            measurements.add(measurement);

            GeodeticCoordinate subPoint = GeodeticTransform.inverse(position);
            observations.add(new SatelliteObservation(
                satellite.id(),
                satellite.name(),
                satellite.group(),
                look.elevationDeg(),
                look.azimuthDeg(),
                measurement.pseudorangeKm() / SPEED_OF_LIGHT_KM_S * MILLIS_PER_SECOND,
                subPoint.latitudeDeg(),
                subPoint.longitudeDeg()));
        }

        int visible = measurements.size();
        log.debug("Cycle at {}: {} catalog entries, {} visible, {} skipped",
            now, limit, visible, skipped);

        NavigationSnapshot previous = stateStore.current();
        Fix fix = previous.fix();
        Fix smoothedFix = previous.smoothedFix();
        SolutionSummary summary = previous.solution();
        CycleOutcome outcome;

        if (visible < PseudorangeSolver.MIN_MEASUREMENTS) {
            outcome = CycleOutcome.SEARCHING;
        } else {
            NavigationProperties.Solver solverConfig = properties.getSolver();
            Optional<Solution> result = solver.solve(
                measurements,
                initialGuess(measurements),
                solverConfig.getMaxIterations(),
                solverConfig.getConvergenceThresholdKm());

            if (result.isEmpty()) {
                lastEstimate = null;
                outcome = CycleOutcome.ACQUIRING;
            } else {
                Solution solution = result.get();
                FixMode mode = solution.converged() ? FixMode.THREE_D_LOCK : FixMode.DEGRADED;
                fix = postProcessor.postprocess(
                    solution.estimate(),
                    observer,
                    properties.getPostProcessing().getBlendWeight(),
                    mode);
                // a DEGRADED fix keeps the previous smoothed fix and stays out of the smoother
                if (!properties.getPostProcessing().getSmoothing().isEnabled()) {
                    smoothedFix = fix;
                } else if (mode == FixMode.THREE_D_LOCK) {
                    smoothedFix = smoother.smooth(fix);
                }
                summary = new SolutionSummary(
                    solution.estimate().clockBiasKm(),
                    solution.converged(),
                    solution.iterationsUsed(),
                    solution.finalCorrectionKm(),
                    solution.gdop(),
                    solution.measurementsUsed());
                lastEstimate = solution.converged() ? solution.estimate() : null;
                outcome = CycleOutcome.TRACKING;
            }
        }

        observations.sort(Comparator.comparingDouble(SatelliteObservation::elevationDeg).reversed());
        int listed = Math.min(observations.size(), properties.getPublication().getMaxListedSatellites());
        recordTransition(outcome);

        stateStore.publish(new NavigationSnapshot(
            cycleCounter.incrementAndGet(),
            now,
            outcome.name() + " (" + visible + " SATS)",
            source,
            fix,
            smoothedFix,
            summary,
            observations.subList(0, listed),
            sampleSpectrum(),
            stateStore.recentEvents()));
        return outcome;
    }

    StateEstimate initialGuess(List<Measurement> measurements) {
        StateEstimate previous = lastEstimate;
        return switch (properties.getSolver().getInitialGuess()) {
            case ORIGIN -> new StateEstimate(EcefCoordinate.ORIGIN, 0.0);
            case CENTROID -> GaussNewtonMultilaterationSolver.surfaceCentroid(measurements);
            case PREVIOUS -> previous != null
                ? previous
                : GaussNewtonMultilaterationSolver.surfaceCentroid(measurements);
        };
    }

    private List<Integer> sampleSpectrum() {
        try {
            return spectrumSource.sample();
        } catch (RuntimeException e) {
            log.warn("Spectrum source {} failed: {}", spectrumSource.getName(), e.getMessage());
            return List.of();
        }
    }

    private void noteCatalog(int size, String source) {
        String description = size + " satellites (" + source + ")";
        if (!description.equals(lastCatalogDescription)) {
            lastCatalogDescription = description;
            stateStore.recordEvent("CATALOG: " + description);
        }
    }

    private void recordTransition(CycleOutcome outcome) {
        CycleOutcome previous = lastOutcome;
        lastOutcome = outcome;
        if (previous == outcome) {
            return;
        }
        switch (outcome) {
            case TRACKING -> stateStore.recordEvent("NAV: Fix acquired");
            case SEARCHING -> stateStore.recordEvent("NAV: Searching, fewer than 4 satellites visible");
            case ACQUIRING -> stateStore.recordEvent("NAV: Geometry rejected by solver");
            case FAILED -> stateStore.recordEvent("NAV: Cycle failed");
        }
    }
}
