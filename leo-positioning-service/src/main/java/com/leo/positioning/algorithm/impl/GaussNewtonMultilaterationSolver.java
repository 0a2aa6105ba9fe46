package com.leo.positioning.algorithm.impl;

import com.leo.positioning.algorithm.PseudorangeSolver;
import com.leo.positioning.algorithm.util.DOPCalculator;
import com.leo.positioning.algorithm.util.GeodeticTransform;
import com.leo.positioning.config.NavigationProperties;
import com.leo.positioning.dto.EcefCoordinate;
import com.leo.positioning.dto.Measurement;
import com.leo.positioning.dto.StateEstimate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Gauss-Newton least-squares solver for receiver position and clock bias.
 *
 * ALGORITHM OVERVIEW:
 * 1. Start from the supplied state X = (x, y, z, b)
 * 2. Build the residual vector and the geometry matrix at X
 * 3. Reject the step when the geometry matrix is ill-conditioned
 * 4. Solve H·Δ = r in the least-squares sense through SVD
 * 5. Apply X ← X + Δ and stop once the position part of Δ is below the threshold
 *
 * MATHEMATICAL MODEL:
 *   dᵢ = ‖p − sᵢ‖
 *   rᵢ = ρᵢ − (dᵢ + b)
 *   Hᵢ = [ (p − sᵢ)ᵀ / max(dᵢ, 1e-6), 1 ]
 *   Δ  = argmin ‖H·Δ − r‖₂
 *
 * The SVD pseudo-inverse handles the over-determined case without forming HᵀH, which would square
 * the condition number.
 *
 * INITIAL STATE:
 * Starting at the Earth's centre works for satellites tens of thousands of kilometres above the
 * receiver. For low orbits the radial offset and the clock bias are nearly interchangeable from
 * the origin and the iteration can wander; callers seed such solves with
 * {@link #surfaceCentroid(List)} or the previous fix instead.
 *
 * FAILURE MODES:
 * - fewer than four measurements: empty result
 * - condition number above the configured limit, or NaN: empty result
 * - non-finite correction: empty result
 * - iteration budget exhausted: solution flagged as not converged
 */
@Slf4j
@Component
public class GaussNewtonMultilaterationSolver implements PseudorangeSolver {

    // ============================================================================
    // SOLVER CONSTANTS
    // ============================================================================

    /** Default ceiling on the 2-norm condition number of the geometry matrix. */
    public static final double DEFAULT_MAX_CONDITION_NUMBER = 1e10;

    private static final String SOLVER_NAME = "gauss-newton";

    private final double maxConditionNumber;

    @Autowired
    public GaussNewtonMultilaterationSolver(NavigationProperties properties) {
        this(properties.getSolver().getMaxConditionNumber());
    }

    public GaussNewtonMultilaterationSolver(double maxConditionNumber) {
        if (!(maxConditionNumber > 1.0)) {
            throw new IllegalArgumentException("Maximum condition number must be greater than 1");
        }
        this.maxConditionNumber = maxConditionNumber;
    }

    public GaussNewtonMultilaterationSolver() {
        this(DEFAULT_MAX_CONDITION_NUMBER);
    }

    @Override
    public Optional<Solution> solve(
            List<Measurement> measurements,
            StateEstimate initialGuess,
            int maxIterations,
            double convergenceThresholdKm) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Iteration budget must be at least 1");
        }
        if (!(convergenceThresholdKm > 0)) {
            throw new IllegalArgumentException("Convergence threshold must be positive");
        }
        if (measurements == null || measurements.size() < MIN_MEASUREMENTS) {
            log.debug("Not enough measurements to solve: {}",
                measurements == null ? 0 : measurements.size());
            return Optional.empty();
        }

        int n = measurements.size();
        double[] state = initialGuess.toVector();
        double correction = Double.POSITIVE_INFINITY;
        boolean converged = false;
        int iteration = 0;

        while (iteration < maxIterations) {
            iteration++;
            EcefCoordinate position = new EcefCoordinate(state[0], state[1], state[2]);

            double[][] geometry = new double[n][];
            double[] residuals = new double[n];
            for (int i = 0; i < n; i++) {
                Measurement m = measurements.get(i);
                double range = position.distanceTo(m.satellitePosition());
                residuals[i] = m.pseudorangeKm() - (range + state[3]);
                geometry[i] = DOPCalculator.geometryRow(position, m.satellitePosition());
            }

            Optional<double[]> step = leastSquaresStep(geometry, residuals);
            if (step.isEmpty()) {
                log.debug("Geometry rejected at iteration {} for {} measurements", iteration, n);
                return Optional.empty();
            }

            double[] delta = step.get();
            for (int k = 0; k < state.length; k++) {
                state[k] += delta[k];
            }

            correction = Math.sqrt(delta[0] * delta[0] + delta[1] * delta[1] + delta[2] * delta[2]);
            if (correction < convergenceThresholdKm) {
                converged = true;
                break;
            }
        }

        StateEstimate estimate = StateEstimate.fromVector(state);
        List<EcefCoordinate> satellites = new ArrayList<>(n);
        measurements.forEach(m -> satellites.add(m.satellitePosition()));
        double gdop = DOPCalculator.calculateGDOP(estimate.position(), satellites);

        if (!converged) {
            log.debug("Solver used its full budget of {} iterations, last correction {} km",
                maxIterations, correction);
        }
        return Optional.of(new Solution(estimate, converged, iteration, correction, gdop, n));
    }

    @Override
    public String getName() {
        return SOLVER_NAME;
    }

    public double getMaxConditionNumber() {
        return maxConditionNumber;
    }

    /**
     * Seed state lying on the ellipsoid's equatorial radius directly beneath the mean satellite
     * position, with zero clock bias.
     *
     * @param measurements measurements whose satellites define the centroid
     * @return seed state, or the origin when the centroid coincides with the Earth's centre
     */
    public static StateEstimate surfaceCentroid(List<Measurement> measurements) {
        double x = 0;
        double y = 0;
        double z = 0;
        for (Measurement m : measurements) {
            x += m.satellitePosition().x();
            y += m.satellitePosition().y();
            z += m.satellitePosition().z();
        }
        double norm = Math.sqrt(x * x + y * y + z * z);
        if (norm == 0.0) {
            return new StateEstimate(EcefCoordinate.ORIGIN, 0.0);
        }
        double scale = GeodeticTransform.SEMI_MAJOR_AXIS_KM / norm;
        return new StateEstimate(new EcefCoordinate(x * scale, y * scale, z * scale), 0.0);
    }

    private Optional<double[]> leastSquaresStep(double[][] geometry, double[] residuals) {
        try {
            RealMatrix h = new Array2DRowRealMatrix(geometry, false);
            SingularValueDecomposition svd = new SingularValueDecomposition(h);
            double condition = svd.getConditionNumber();
            if (!(condition <= maxConditionNumber)) {
                log.debug("Condition number {} exceeds limit {}", condition, maxConditionNumber);
                return Optional.empty();
            }

            RealVector delta = svd.getSolver().solve(new ArrayRealVector(residuals, false));
            double[] values = delta.toArray();
            for (double v : values) {
                if (!Double.isFinite(v)) {
                    return Optional.empty();
                }
            }
            return Optional.of(values);
        } catch (MathIllegalArgumentException | MathArithmeticException e) {
            log.debug("Least-squares step failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
