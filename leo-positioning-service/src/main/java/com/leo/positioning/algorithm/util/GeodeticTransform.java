package com.leo.positioning.algorithm.util;

import com.leo.positioning.dto.EcefCoordinate;
import com.leo.positioning.dto.GeodeticCoordinate;
import com.leo.positioning.dto.LookAngles;

/**
 * Conversions between WGS-84 geodetic coordinates and Earth-centred, Earth-fixed Cartesian
 * coordinates, plus topocentric look angles.
 *
 * <p>Mathematical Foundation:
 *
 * <pre>
 *   N(φ) = a / √(1 − e²·sin²φ)             prime-vertical radius of curvature
 *   x = (N + h)·cosφ·cosλ
 *   y = (N + h)·cosφ·sinλ
 *   z = (N·(1 − e²) + h)·sinφ
 * </pre>
 *
 * <p>The inverse uses a fixed three-step fixed-point iteration on latitude. Each step shrinks the
 * latitude error by roughly e², so three steps leave a residual well below one millimetre for
 * |φ| &lt; 89° and altitudes within a few tens of kilometres of the ellipsoid. The loop is not
 * convergence-checked.
 *
 * <p>ECEF components are kilometres; geodetic altitude is metres.
 */
public final class GeodeticTransform {

  // ============================================================================
  // WGS-84 ELLIPSOID CONSTANTS
  // ============================================================================

  /** Semi-major axis of the WGS-84 ellipsoid in kilometres. */
  public static final double SEMI_MAJOR_AXIS_KM = 6378.137;

  /** First eccentricity squared of the WGS-84 ellipsoid. */
  public static final double ECCENTRICITY_SQUARED = 0.00669437999;

  /** Number of latitude refinement steps in {@link #inverse(EcefCoordinate)}. */
  public static final int INVERSE_ITERATIONS = 3;

  private static final double METERS_PER_KILOMETER = 1000.0;
  private static final double FULL_CIRCLE_DEGREES = 360.0;

  private GeodeticTransform() {
    throw new AssertionError("Utility class should not be instantiated");
  }

  /**
   * Converts a geodetic coordinate to ECEF.
   *
   * @param geo geodetic position (degrees, metres)
   * @return ECEF position in kilometres
   */
  public static EcefCoordinate forward(GeodeticCoordinate geo) {
    double lat = Math.toRadians(geo.latitudeDeg());
    double lon = Math.toRadians(geo.longitudeDeg());
    double altKm = geo.altitudeM() / METERS_PER_KILOMETER;
    double n = primeVerticalRadius(lat);

    double cosLat = Math.cos(lat);
    return new EcefCoordinate(
        (n + altKm) * cosLat * Math.cos(lon),
        (n + altKm) * cosLat * Math.sin(lon),
        (n * (1 - ECCENTRICITY_SQUARED) + altKm) * Math.sin(lat));
  }

  /**
   * Converts an ECEF position to geodetic coordinates using {@value #INVERSE_ITERATIONS}
   * fixed-point latitude refinements.
   *
   * @param ecef ECEF position in kilometres
   * @return geodetic position (degrees, metres)
   */
  public static GeodeticCoordinate inverse(EcefCoordinate ecef) {
    double x = ecef.x();
    double y = ecef.y();
    double z = ecef.z();

    double p = Math.sqrt(x * x + y * y);
    double lon = Math.atan2(y, x);
    double lat = Math.atan2(z, p * (1 - ECCENTRICITY_SQUARED));
    double n = primeVerticalRadius(lat);

    for (int i = 0; i < INVERSE_ITERATIONS; i++) {
      n = primeVerticalRadius(lat);
      lat = Math.atan2(z + ECCENTRICITY_SQUARED * n * Math.sin(lat), p);
    }

    double altKm = p / Math.cos(lat) - n;
    return new GeodeticCoordinate(
        Math.toDegrees(lat), Math.toDegrees(lon), altKm * METERS_PER_KILOMETER);
  }

  /**
   * Computes azimuth, elevation and slant range of an ECEF target seen from a geodetic observer,
   * through the observer's local east-north-up frame.
   *
   * @param observer observer position
   * @param target target position in ECEF kilometres
   * @return look angles; azimuth in [0, 360) measured clockwise from north
   */
  public static LookAngles lookAngles(GeodeticCoordinate observer, EcefCoordinate target) {
    EcefCoordinate delta = target.minus(forward(observer));

    double lat = Math.toRadians(observer.latitudeDeg());
    double lon = Math.toRadians(observer.longitudeDeg());
    double sinLat = Math.sin(lat);
    double cosLat = Math.cos(lat);
    double sinLon = Math.sin(lon);
    double cosLon = Math.cos(lon);

    double east = -sinLon * delta.x() + cosLon * delta.y();
    double north = -sinLat * cosLon * delta.x() - sinLat * sinLon * delta.y() + cosLat * delta.z();
    double up = cosLat * cosLon * delta.x() + cosLat * sinLon * delta.y() + sinLat * delta.z();

    double azimuth = Math.toDegrees(Math.atan2(east, north));
    if (azimuth < 0) {
      azimuth += FULL_CIRCLE_DEGREES;
    }
    double elevation = Math.toDegrees(Math.atan2(up, Math.hypot(east, north)));

    return new LookAngles(azimuth, elevation, delta.norm());
  }

  /** Euclidean distance between two ECEF points in kilometres. */
  public static double slantRangeKm(EcefCoordinate a, EcefCoordinate b) {
    return a.distanceTo(b);
  }

  private static double primeVerticalRadius(double latRad) {
    double sinLat = Math.sin(latRad);
    return SEMI_MAJOR_AXIS_KM / Math.sqrt(1 - ECCENTRICITY_SQUARED * sinLat * sinLat);
  }
}
