package com.leo.positioning.dto;

import com.leo.positioning.catalog.OrbitalElements;
import java.util.Objects;

/** Catalog entry for a trackable satellite. */
public record SatelliteDescriptor(String id, String name, String group, OrbitalElements elements) {
  public SatelliteDescriptor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(elements, "elements");
    if (name == null) {
      name = id;
    }
  }
}
