package com.leo.positioning.spectrum;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Spectrum of independent uniform magnitudes in [min, max], inclusive on both ends.
 */
public class SyntheticSpectrumSource implements SpectrumSource {

  private final Random random;
  private final int bins;
  private final int minMagnitude;
  private final int maxMagnitude;

  public SyntheticSpectrumSource(Random random, int bins, int minMagnitude, int maxMagnitude) {
    if (bins < 1) {
      throw new IllegalArgumentException("Spectrum needs at least one bin");
    }
    if (minMagnitude < 0 || maxMagnitude < minMagnitude) {
      throw new IllegalArgumentException("Magnitude range must satisfy 0 <= min <= max");
    }
    this.random = random;
    this.bins = bins;
    this.minMagnitude = minMagnitude;
    this.maxMagnitude = maxMagnitude;
  }

  @Override
  public List<Integer> sample() {
    List<Integer> magnitudes = new ArrayList<>(bins);
    int span = maxMagnitude - minMagnitude + 1;
    for (int i = 0; i < bins; i++) {
      magnitudes.add(minMagnitude + random.nextInt(span));
    }
    return List.copyOf(magnitudes);
  }

  @Override
  public String getName() {
    return "SYNTHETIC";
  }
}
