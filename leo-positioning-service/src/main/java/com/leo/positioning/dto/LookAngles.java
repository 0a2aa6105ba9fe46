package com.leo.positioning.dto;

/** Topocentric direction from an observer to a target: degrees and kilometres. */
public record LookAngles(double azimuthDeg, double elevationDeg, double rangeKm) {}
