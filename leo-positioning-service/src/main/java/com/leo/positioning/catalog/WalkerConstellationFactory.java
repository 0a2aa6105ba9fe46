package com.leo.positioning.catalog;

import com.leo.positioning.config.NavigationProperties.Catalog.Constellation;
import com.leo.positioning.dto.SatelliteDescriptor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds satellite catalogs from Walker-delta constellation patterns i:T/P/F.
 *
 * <pre>
 *   Ωₚ  = 360°·p / P
 *   uₚₛ = 360°·s / S + 360°·F·p / T,   S = T / P
 * </pre>
 *
 * <p>Satellite ids take the form {@code NAME-PP-SS}; the group is the constellation name in lower
 * case.
 */
@Slf4j
public final class WalkerConstellationFactory {

  private static final double FULL_CIRCLE_DEGREES = 360.0;

  private WalkerConstellationFactory() {
    throw new AssertionError("Utility class should not be instantiated");
  }

  /**
   * Builds every configured constellation at a common epoch.
   *
   * @param constellations constellation patterns
   * @param epoch element epoch
   * @return catalog entries in constellation, plane, slot order
   */
  public static List<SatelliteDescriptor> build(List<Constellation> constellations, Instant epoch) {
    List<SatelliteDescriptor> satellites = new ArrayList<>();
    for (Constellation constellation : constellations) {
      satellites.addAll(build(constellation, epoch));
    }
    return satellites;
  }

  /**
   * Builds one constellation.
   *
   * @param constellation pattern
   * @param epoch element epoch
   * @return catalog entries
   * @throws IllegalArgumentException if the name is blank or the plane or slot count is not positive
   */
  public static List<SatelliteDescriptor> build(Constellation constellation, Instant epoch) {
    String name = constellation.getName();
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Constellation name is required");
    }
    int planes = constellation.getPlanes();
    int perPlane = constellation.getSatellitesPerPlane();
    if (planes < 1 || perPlane < 1) {
      throw new IllegalArgumentException(
          "Constellation " + name + " needs at least one plane and one satellite per plane");
    }

    int total = planes * perPlane;
    String prefix = name.toUpperCase(Locale.ROOT);
    String group = name.toLowerCase(Locale.ROOT);
    List<SatelliteDescriptor> satellites = new ArrayList<>(total);

    for (int p = 0; p < planes; p++) {
      double raan = FULL_CIRCLE_DEGREES * p / planes;
      double planePhase = FULL_CIRCLE_DEGREES * constellation.getPhasing() * p / total;
      for (int s = 0; s < perPlane; s++) {
        double argumentOfLatitude = (FULL_CIRCLE_DEGREES * s / perPlane + planePhase)
            % FULL_CIRCLE_DEGREES;
        OrbitalElements elements = new OrbitalElements(
            constellation.getAltitudeKm(),
            constellation.getInclinationDeg(),
            raan,
            argumentOfLatitude,
            epoch);
        String id = String.format(Locale.ROOT, "%s-%02d-%02d", prefix, p + 1, s + 1);
        satellites.add(new SatelliteDescriptor(id, id, group, elements));
      }
    }

    log.debug("Built constellation {}: {} planes x {} satellites at {} km",
        name, planes, perPlane, constellation.getAltitudeKm());
    return satellites;
  }
}
