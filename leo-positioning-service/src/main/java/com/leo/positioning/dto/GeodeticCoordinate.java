package com.leo.positioning.dto;

/**
 * Geodetic position on the WGS-84 ellipsoid. Latitude and longitude are in degrees, altitude is in
 * metres above the ellipsoid.
 */
public record GeodeticCoordinate(double latitudeDeg, double longitudeDeg, double altitudeM) {
  public GeodeticCoordinate {
    if (Double.isNaN(latitudeDeg) || latitudeDeg < -90 || latitudeDeg > 90) {
      throw new IllegalArgumentException("Invalid latitude value: " + latitudeDeg);
    }
    if (Double.isNaN(longitudeDeg) || longitudeDeg < -180 || longitudeDeg > 180) {
      throw new IllegalArgumentException("Invalid longitude value: " + longitudeDeg);
    }
    if (!Double.isFinite(altitudeM)) {
      throw new IllegalArgumentException("Altitude must be a finite number");
    }
  }
}
