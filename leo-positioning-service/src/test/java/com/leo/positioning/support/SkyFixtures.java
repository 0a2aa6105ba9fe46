package com.leo.positioning.support;

import com.leo.positioning.algorithm.util.GeodeticTransform;
import com.leo.positioning.dto.EcefCoordinate;
import com.leo.positioning.dto.GeodeticCoordinate;
import com.leo.positioning.dto.Measurement;
import java.util.ArrayList;
import java.util.List;

/** Satellite geometries around a fixed reference observer. */
public final class SkyFixtures {

  public static final GeodeticCoordinate OBSERVER =
      new GeodeticCoordinate(12.9706089, 80.0431389, 45.0);

  public static final double CLOCK_BIAS_KM = 120.0;

  private SkyFixtures() {}

  /** A point {@code altitudeKm} above the observer shifted by the given degrees. */
  public static EcefCoordinate above(double dLatDeg, double dLonDeg, double altitudeKm) {
    return GeodeticTransform.forward(new GeodeticCoordinate(
        OBSERVER.latitudeDeg() + dLatDeg, OBSERVER.longitudeDeg() + dLonDeg, altitudeKm * 1000.0));
  }

  /** Five low-orbit satellites, all between roughly 20 and 90 degrees elevation. */
  public static List<EcefCoordinate> leoSky() {
    return List.of(
        above(0, 0, 1000),
        above(15, 0, 1000),
        above(-15, 0, 1000),
        above(0, 15, 1000),
        above(0, -15, 1000));
  }

  /** Four low-orbit satellites in an irregular pattern. */
  public static List<EcefCoordinate> sparseLeoSky() {
    return List.of(
        above(10, 5, 1000),
        above(-5, 10, 1000),
        above(3, -12, 1000),
        above(-9, -9, 1000));
  }

  /** Five medium-orbit satellites spread widely across the sky. */
  public static List<EcefCoordinate> meoSky() {
    return List.of(
        above(0, 0, 20200),
        above(45, 0, 20200),
        above(-45, 0, 20200),
        above(0, 50, 20200),
        above(0, -50, 20200));
  }

  public static EcefCoordinate truth() {
    return GeodeticTransform.forward(OBSERVER);
  }

  /** Noiseless pseudoranges to the observer with the standard clock bias. */
  public static List<Measurement> pseudoranges(List<EcefCoordinate> satellites) {
    EcefCoordinate truth = truth();
    List<Measurement> measurements = new ArrayList<>();
    for (EcefCoordinate satellite : satellites) {
      measurements.add(new Measurement(satellite, satellite.distanceTo(truth) + CLOCK_BIAS_KM));
    }
    return measurements;
  }
}
