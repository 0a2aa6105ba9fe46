package com.leo.positioning.service;

/** How a navigation cycle ended. */
public enum CycleOutcome {
  /** A solution was published. */
  TRACKING("tracking"),
  /** Fewer than four satellites were visible. */
  SEARCHING("searching"),
  /** Enough satellites, but the solver rejected the geometry. */
  ACQUIRING("acquiring"),
  /** The cycle hit an unexpected error; nothing new was published. */
  FAILED("failed");

  private final String reason;

  CycleOutcome(String reason) {
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }

  public boolean hasFix() {
    return this == TRACKING;
  }
}
