package com.leo.positioning.dto;

import java.util.Objects;

/**
 * A single pseudorange observation: the satellite position at signal time and the measured range
 * (geometric range plus receiver clock bias plus noise), both in kilometres. Lives for one cycle.
 */
public record Measurement(EcefCoordinate satellitePosition, double pseudorangeKm) {
  public Measurement {
    Objects.requireNonNull(satellitePosition, "satellitePosition");
    if (!Double.isFinite(pseudorangeKm)) {
      throw new IllegalArgumentException("Pseudorange must be a finite number");
    }
  }
}
