package com.leo.positioning.dto;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable output of one navigation cycle. Readers always see a whole snapshot: the store swaps
 * one reference per cycle and every collection here is an unmodifiable copy.
 *
 * <p>{@code solution} is null until the first successful solve.
 */
public record NavigationSnapshot(
    long cycle,
    Instant publishedAt,
    String status,
    String source,
    Fix fix,
    Fix smoothedFix,
    SolutionSummary solution,
    List<SatelliteObservation> satellites,
    List<Integer> spectrum,
    List<String> log) {

  public NavigationSnapshot {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(fix, "fix");
    satellites = satellites == null ? List.of() : List.copyOf(satellites);
    spectrum = spectrum == null ? List.of() : List.copyOf(spectrum);
    log = log == null ? List.of() : List.copyOf(log);
    if (smoothedFix == null) {
      smoothedFix = fix;
    }
  }

  public static NavigationSnapshot booting(Instant now) {
    return new NavigationSnapshot(
        0L, now, "BOOTING", "INIT", Fix.initial(), Fix.initial(), null, List.of(), List.of(),
        List.of());
  }
}
