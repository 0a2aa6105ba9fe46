package com.leo.positioning.algorithm;

import com.leo.positioning.dto.EcefCoordinate;
import com.leo.positioning.dto.Measurement;
import com.leo.positioning.dto.StateEstimate;
import java.util.List;
import java.util.Optional;

/**
 * Estimates receiver position and clock bias from a set of pseudoranges.
 */
public interface PseudorangeSolver {

  /** Four unknowns: x, y, z and clock bias. */
  int MIN_MEASUREMENTS = 4;

  /**
   * Solves starting from the Earth's centre with zero bias.
   *
   * @param measurements pseudoranges for this cycle
   * @param maxIterations upper bound on iterations
   * @param convergenceThresholdKm stop once the position correction falls below this
   * @return the solution, or empty when there are too few measurements or the geometry is singular
   */
  default Optional<Solution> solve(
      List<Measurement> measurements, int maxIterations, double convergenceThresholdKm) {
    return solve(
        measurements,
        new StateEstimate(EcefCoordinate.ORIGIN, 0.0),
        maxIterations,
        convergenceThresholdKm);
  }

  /**
   * Solves starting from a caller-supplied state.
   *
   * @param measurements pseudoranges for this cycle
   * @param initialGuess starting state
   * @param maxIterations upper bound on iterations
   * @param convergenceThresholdKm stop once the position correction falls below this
   * @return the solution, or empty when there are too few measurements or the geometry is singular
   */
  Optional<Solution> solve(
      List<Measurement> measurements,
      StateEstimate initialGuess,
      int maxIterations,
      double convergenceThresholdKm);

  /**
   * Returns the name of the solver.
   *
   * @return solver name
   */
  String getName();

  /**
   * Result of a solve. {@code converged} is false when the iteration budget ran out before the
   * correction dropped below the threshold; the estimate is then the last iterate.
   */
  record Solution(
      StateEstimate estimate,
      boolean converged,
      int iterationsUsed,
      double finalCorrectionKm,
      double gdop,
      int measurementsUsed) {}
}
