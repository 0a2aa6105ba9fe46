package com.leo.positioning.dto;

/** Solver diagnostics accompanying a published fix. */
public record SolutionSummary(
    double clockBiasKm,
    boolean converged,
    int iterationsUsed,
    double finalCorrectionKm,
    double gdop,
    int measurementsUsed) {}
