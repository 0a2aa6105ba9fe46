package com.leo.positioning.dto;

import java.util.Objects;

/**
 * Published navigation fix. Latitude and longitude in degrees, altitude and error in metres.
 *
 * <p>{@code errorMeters} is a planar small-angle figure (111 km per degree on both axes), so it is
 * only meaningful for small offsets away from high latitudes.
 */
public record Fix(
    double latitude, double longitude, double altitude, double errorMeters, FixMode mode) {
  public Fix {
    Objects.requireNonNull(mode, "mode");
    if (errorMeters < 0 || Double.isNaN(errorMeters)) {
      throw new IllegalArgumentException("Invalid error value");
    }
  }

  public static Fix initial() {
    return new Fix(0.0, 0.0, 0.0, 0.0, FixMode.INIT);
  }
}
