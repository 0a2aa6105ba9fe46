package com.leo.positioning.algorithm;

import com.leo.positioning.config.NavigationProperties;
import com.leo.positioning.dto.Fix;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Exponential smoothing of successive fixes for display.
 *
 * <pre>
 *   s₀ = f₀
 *   sₖ = sₖ₋₁ + α·(fₖ − sₖ₋₁)
 * </pre>
 *
 * <p>Only the fix history is used; nothing pulls toward a reference point. Longitude differences
 * are taken the short way round the antimeridian.
 */
@Component
public class ExponentialFixSmoother {

  private final double alpha;
  private Fix state;

  @Autowired
  public ExponentialFixSmoother(NavigationProperties properties) {
    this(properties.getPostProcessing().getSmoothing().getAlpha());
  }

  public ExponentialFixSmoother(double alpha) {
    if (!(alpha > 0.0 && alpha <= 1.0)) {
      throw new IllegalArgumentException("Smoothing factor must be within (0, 1]");
    }
    this.alpha = alpha;
  }

  /**
   * Folds a new fix into the smoothed state.
   *
   * @param fix latest fix
   * @return the smoothed fix, carrying the latest fix's mode
   */
  public synchronized Fix smooth(Fix fix) {
    if (state == null) {
      state = fix;
      return fix;
    }

    double dLon = fix.longitude() - state.longitude();
    if (dLon > 180.0) {
      dLon -= 360.0;
    } else if (dLon < -180.0) {
      dLon += 360.0;
    }
    double lon = state.longitude() + alpha * dLon;
    if (lon > 180.0) {
      lon -= 360.0;
    } else if (lon < -180.0) {
      lon += 360.0;
    }

    state = new Fix(
        state.latitude() + alpha * (fix.latitude() - state.latitude()),
        lon,
        state.altitude() + alpha * (fix.altitude() - state.altitude()),
        state.errorMeters() + alpha * (fix.errorMeters() - state.errorMeters()),
        fix.mode());
    return state;
  }

  public synchronized void reset() {
    state = null;
  }
}
