package com.leo.positioning.catalog;

import com.leo.positioning.algorithm.util.GeodeticTransform;
import com.leo.positioning.dto.EcefCoordinate;
import com.leo.positioning.dto.GeodeticCoordinate;
import com.leo.positioning.dto.LookAngles;
import com.leo.positioning.dto.SatelliteDescriptor;
import com.leo.positioning.exception.PropagationException;
import java.time.Instant;

/**
 * Produces Earth-fixed satellite positions for a given instant.
 */
public interface OrbitPropagator {

  /**
   * Propagates a satellite to an instant.
   *
   * @param satellite catalog entry
   * @param instant time of interest
   * @return ECEF position in kilometres
   * @throws PropagationException if the position cannot be computed
   */
  EcefCoordinate propagate(SatelliteDescriptor satellite, Instant instant);

  /**
   * Look angles of a propagated position from an observer.
   *
   * @param observer observer position
   * @param satellitePosition satellite ECEF position in kilometres
   * @return azimuth, elevation and slant range
   */
  default LookAngles lookAngles(GeodeticCoordinate observer, EcefCoordinate satellitePosition) {
    return GeodeticTransform.lookAngles(observer, satellitePosition);
  }
}
