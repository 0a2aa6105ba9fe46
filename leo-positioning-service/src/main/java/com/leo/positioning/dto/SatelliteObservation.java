package com.leo.positioning.dto;

/**
 * A visible satellite as published for one cycle: look angles, time of flight of the synthesized
 * pseudorange in milliseconds, and the sub-satellite point.
 */
public record SatelliteObservation(
    String id,
    String name,
    String group,
    double elevationDeg,
    double azimuthDeg,
    double timeOfFlightMs,
    double subLatitude,
    double subLongitude) {}
