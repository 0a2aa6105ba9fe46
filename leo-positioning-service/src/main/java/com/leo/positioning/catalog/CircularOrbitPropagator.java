package com.leo.positioning.catalog;

import com.leo.positioning.algorithm.util.GeodeticTransform;
import com.leo.positioning.dto.EcefCoordinate;
import com.leo.positioning.dto.SatelliteDescriptor;
import com.leo.positioning.exception.PropagationException;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;

/**
 * Two-body propagator for circular orbits with Earth rotation.
 *
 * <pre>
 *   r = a + h,   n = √(μ / r³)
 *   u(t) = u₀ + n·(t − t₀)
 *   x = r·(cosΩ·cos u − sinΩ·sin u·cos i)
 *   y = r·(sinΩ·cos u + cosΩ·sin u·cos i)
 *   z = r·sin u·sin i
 * </pre>
 *
 * <p>The inertial frame coincides with the Earth-fixed frame at the element epoch, so the
 * Earth-fixed position is the above rotated by −ω⊕·(t − t₀) about z. No perturbations are modelled.
 */
@Slf4j
public class CircularOrbitPropagator implements OrbitPropagator {

  // ============================================================================
  // EARTH MODEL CONSTANTS
  // ============================================================================

  /** Standard gravitational parameter of the Earth, km³/s². */
  public static final double EARTH_MU_KM3_S2 = 398600.4418;

  /** Sidereal rotation rate of the Earth, rad/s. */
  public static final double EARTH_ROTATION_RAD_S = 7.2921159e-5;

  private static final double NANOS_PER_SECOND = 1e9;

  @Override
  public EcefCoordinate propagate(SatelliteDescriptor satellite, Instant instant) {
    if (instant == null) {
      throw new PropagationException(satellite.id(), "No propagation instant supplied");
    }
    OrbitalElements elements = satellite.elements();

    double dt;
    try {
      Duration elapsed = Duration.between(elements.epoch(), instant);
      dt = elapsed.getSeconds() + elapsed.getNano() / NANOS_PER_SECOND;
    } catch (ArithmeticException e) {
      throw new PropagationException(satellite.id(), "Propagation interval out of range", e);
    }

    double radius = GeodeticTransform.SEMI_MAJOR_AXIS_KM + elements.altitudeKm();
    double meanMotion = Math.sqrt(EARTH_MU_KM3_S2 / (radius * radius * radius));

    double u = Math.toRadians(elements.argumentOfLatitudeDeg()) + meanMotion * dt;
    double raan = Math.toRadians(elements.raanDeg());
    double inc = Math.toRadians(elements.inclinationDeg());

    double cosU = Math.cos(u);
    double sinU = Math.sin(u);
    double cosRaan = Math.cos(raan);
    double sinRaan = Math.sin(raan);
    double cosInc = Math.cos(inc);

    double xi = radius * (cosRaan * cosU - sinRaan * sinU * cosInc);
    double yi = radius * (sinRaan * cosU + cosRaan * sinU * cosInc);
    double zi = radius * sinU * Math.sin(inc);

    double theta = EARTH_ROTATION_RAD_S * dt;
    double cosTheta = Math.cos(theta);
    double sinTheta = Math.sin(theta);

    double x = xi * cosTheta + yi * sinTheta;
    double y = -xi * sinTheta + yi * cosTheta;

    if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(zi)) {
      throw new PropagationException(satellite.id(), "Propagated position is not finite");
    }
    return new EcefCoordinate(x, y, zi);
  }

  /** Orbital period in seconds for a circular orbit at the given altitude. */
  public static double periodSeconds(double altitudeKm) {
    double radius = GeodeticTransform.SEMI_MAJOR_AXIS_KM + altitudeKm;
    return 2 * Math.PI * Math.sqrt(radius * radius * radius / EARTH_MU_KM3_S2);
  }
}
