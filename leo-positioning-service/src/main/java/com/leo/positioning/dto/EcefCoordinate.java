package com.leo.positioning.dto;

/** Earth-centred, Earth-fixed Cartesian position. All components are in kilometres. */
public record EcefCoordinate(double x, double y, double z) {

  public static final EcefCoordinate ORIGIN = new EcefCoordinate(0.0, 0.0, 0.0);

  public EcefCoordinate {
    if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(z)) {
      throw new IllegalArgumentException("ECEF components must be finite numbers");
    }
  }

  public EcefCoordinate minus(EcefCoordinate other) {
    return new EcefCoordinate(x - other.x, y - other.y, z - other.z);
  }

  public double norm() {
    return Math.sqrt(x * x + y * y + z * z);
  }

  public double distanceTo(EcefCoordinate other) {
    return minus(other).norm();
  }
}
