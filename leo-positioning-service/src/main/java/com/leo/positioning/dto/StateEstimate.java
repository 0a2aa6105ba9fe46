package com.leo.positioning.dto;

import java.util.Objects;

/**
 * Receiver state solved from pseudoranges: ECEF position plus the common clock bias expressed as a
 * range in kilometres.
 */
public record StateEstimate(EcefCoordinate position, double clockBiasKm) {
  public StateEstimate {
    Objects.requireNonNull(position, "position");
    if (!Double.isFinite(clockBiasKm)) {
      throw new IllegalArgumentException("Clock bias must be a finite number");
    }
  }

  public static StateEstimate fromVector(double[] state) {
    return new StateEstimate(new EcefCoordinate(state[0], state[1], state[2]), state[3]);
  }

  public double[] toVector() {
    return new double[] {position.x(), position.y(), position.z(), clockBiasKm};
  }
}
