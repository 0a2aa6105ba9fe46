package com.leo.positioning.spectrum;

import java.util.List;

/**
 * Supplies one RF spectrum sample per navigation cycle.
 */
public interface SpectrumSource {

  /**
   * Takes a sample.
   *
   * @return non-negative bin magnitudes; empty when no sample is available
   */
  List<Integer> sample();

  /** Short label for logs and health details. */
  String getName();
}
