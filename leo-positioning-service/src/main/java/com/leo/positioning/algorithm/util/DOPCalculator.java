package com.leo.positioning.algorithm.util;

import com.leo.positioning.dto.EcefCoordinate;
import java.util.List;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dilution-of-precision and conditioning metrics for pseudorange geometry.
 *
 * <p>Mathematical Foundation:
 *
 * <pre>
 *   H = [ uᵢᵀ  1 ]        uᵢ = (p̂ − sᵢ) / ‖p̂ − sᵢ‖, one row per satellite
 *   Q = (HᵀH)⁻¹
 *   GDOP = √trace(Q)
 *   PDOP = √(Q₁₁ + Q₂₂ + Q₃₃)
 * </pre>
 *
 * <p>Academic References: Kaplan & Hegarty "Understanding GPS" (2006), Langley "Dilution of
 * Precision", GPS World (1999).
 */
public final class DOPCalculator {

  private static final Logger logger = LoggerFactory.getLogger(DOPCalculator.class);

  // ============================================================================
  // DOP CALCULATION CONSTANTS
  // ============================================================================

  /**
   * Ceiling reported for unusable geometry. Values above this mean the satellite constellation
   * gives essentially no position information.
   */
  public static final double MAX_ALLOWED_DOP = 99.9;

  /** Four unknowns: three position components plus receiver clock bias. */
  public static final int STATE_DIMENSION = 4;

  /** Distance below which a line-of-sight vector is not normalised, in kilometres. */
  public static final double MIN_LINE_OF_SIGHT_KM = 1e-6;

  private static final double BIAS_TERM_VALUE = 1.0;

  /** Pivot magnitude below which HᵀH is treated as singular. */
  private static final double SINGULARITY_THRESHOLD = 1e-12;

  private DOPCalculator() {
    throw new AssertionError("Utility class should not be instantiated");
  }

  /**
   * Builds one design-matrix row [losₓ, los_y, los_z, 1] for a satellite seen from the estimated
   * position. The line-of-sight points from the satellite towards the estimate, which is the
   * gradient of ‖p − s‖ with respect to p.
   *
   * @param estimate estimated receiver position
   * @param satellite satellite position
   * @return four-element design row
   */
  public static double[] geometryRow(EcefCoordinate estimate, EcefCoordinate satellite) {
    double dx = estimate.x() - satellite.x();
    double dy = estimate.y() - satellite.y();
    double dz = estimate.z() - satellite.z();
    double range = Math.max(Math.sqrt(dx * dx + dy * dy + dz * dz), MIN_LINE_OF_SIGHT_KM);
    return new double[] {dx / range, dy / range, dz / range, BIAS_TERM_VALUE};
  }

  /**
   * Builds the full geometry matrix for a receiver estimate and a set of satellites.
   *
   * @param estimate estimated receiver position
   * @param satellites satellite positions
   * @return n×4 geometry matrix
   */
  public static double[][] geometryMatrix(EcefCoordinate estimate, List<EcefCoordinate> satellites) {
    double[][] matrix = new double[satellites.size()][];
    for (int i = 0; i < satellites.size(); i++) {
      matrix[i] = geometryRow(estimate, satellites.get(i));
    }
    return matrix;
  }

  /**
   * Calculates GDOP for the given geometry.
   *
   * @param estimate estimated receiver position
   * @param satellites satellite positions
   * @return GDOP, capped at {@link #MAX_ALLOWED_DOP}; the cap is returned for singular geometry
   */
  public static double calculateGDOP(EcefCoordinate estimate, List<EcefCoordinate> satellites) {
    RealMatrix covariance = covariance(estimate, satellites);
    if (covariance == null) {
      return MAX_ALLOWED_DOP;
    }
    double gdop = Math.sqrt(Math.max(0.0, covariance.getTrace()));
    logger.debug("Calculated GDOP = {} for {} satellites", gdop, satellites.size());
    return capped(gdop);
  }

  /**
   * Calculates PDOP, the position-only part of the covariance trace.
   *
   * @param estimate estimated receiver position
   * @param satellites satellite positions
   * @return PDOP, capped at {@link #MAX_ALLOWED_DOP}
   */
  public static double calculatePDOP(EcefCoordinate estimate, List<EcefCoordinate> satellites) {
    RealMatrix covariance = covariance(estimate, satellites);
    if (covariance == null) {
      return MAX_ALLOWED_DOP;
    }
    double trace =
        covariance.getEntry(0, 0) + covariance.getEntry(1, 1) + covariance.getEntry(2, 2);
    return capped(Math.sqrt(Math.max(0.0, trace)));
  }

  /**
   * Ratio of largest to smallest singular value of a matrix. Infinite for rank-deficient input.
   *
   * @param matrix design matrix
   * @return 2-norm condition number
   */
  public static double conditionNumber(double[][] matrix) {
    SingularValueDecomposition svd = new SingularValueDecomposition(new Array2DRowRealMatrix(matrix));
    double[] singularValues = svd.getSingularValues();
    double smallest = singularValues[singularValues.length - 1];
    if (smallest <= 0.0) {
      return Double.POSITIVE_INFINITY;
    }
    return singularValues[0] / smallest;
  }

  private static double capped(double dop) {
    return Double.isFinite(dop) ? Math.min(MAX_ALLOWED_DOP, dop) : MAX_ALLOWED_DOP;
  }

  private static RealMatrix covariance(EcefCoordinate estimate, List<EcefCoordinate> satellites) {
    if (estimate == null || satellites == null || satellites.size() < STATE_DIMENSION) {
      logger.debug("Insufficient satellites or null estimate for DOP calculation");
      return null;
    }
    RealMatrix h = new Array2DRowRealMatrix(geometryMatrix(estimate, satellites), false);
    RealMatrix hth = h.transpose().multiply(h);
    DecompositionSolver solver = new QRDecomposition(hth, SINGULARITY_THRESHOLD).getSolver();
    if (!solver.isNonSingular()) {
      logger.debug("Geometry matrix is singular, cannot compute covariance matrix");
      return null;
    }
    return solver.getInverse();
  }
}
