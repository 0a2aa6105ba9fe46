package com.leo.positioning.dto;

/** Quality of the published fix. */
public enum FixMode {
  INIT("INIT"),
  THREE_D_LOCK("3D LOCK"),
  DEGRADED("DEGRADED");

  private final String label;

  FixMode(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }
}
