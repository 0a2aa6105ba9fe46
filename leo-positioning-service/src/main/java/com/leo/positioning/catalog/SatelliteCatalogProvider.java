package com.leo.positioning.catalog;

import com.leo.positioning.dto.SatelliteDescriptor;
import java.util.List;

/**
 * Source of the trackable satellite catalog.
 */
public interface SatelliteCatalogProvider {

  /**
   * Returns a stable, immutable view of the catalog. Later replacements never alter a list
   * already handed out.
   *
   * @return catalog entries
   */
  List<SatelliteDescriptor> snapshot();

  /**
   * Where the current catalog came from, e.g. {@code CONFIGURED} or {@code LIVE NETWORK}.
   *
   * @return source label
   */
  String getSourceLabel();
}
