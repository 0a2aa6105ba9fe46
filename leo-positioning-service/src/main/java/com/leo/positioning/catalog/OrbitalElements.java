package com.leo.positioning.catalog;

import java.time.Instant;
import java.util.Objects;

/**
 * Circular-orbit elements. Angles in degrees, altitude above the equatorial radius in kilometres.
 *
 * <p>{@code raanDeg} is measured in the Earth-fixed frame at {@code epoch}, and
 * {@code argumentOfLatitudeDeg} is the satellite's angle from the ascending node at that instant.
 */
public record OrbitalElements(
    double altitudeKm,
    double inclinationDeg,
    double raanDeg,
    double argumentOfLatitudeDeg,
    Instant epoch) {
  public OrbitalElements {
    Objects.requireNonNull(epoch, "epoch");
    if (!(altitudeKm > 0) || Double.isInfinite(altitudeKm)) {
      throw new IllegalArgumentException("Orbit altitude must be positive");
    }
    if (!(inclinationDeg >= 0 && inclinationDeg <= 180)) {
      throw new IllegalArgumentException("Inclination must be within [0, 180] degrees");
    }
    if (!Double.isFinite(raanDeg) || !Double.isFinite(argumentOfLatitudeDeg)) {
      throw new IllegalArgumentException("Orbit angles must be finite numbers");
    }
  }
}
