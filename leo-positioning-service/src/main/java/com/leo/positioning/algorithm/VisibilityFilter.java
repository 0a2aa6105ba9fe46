package com.leo.positioning.algorithm;

import com.leo.positioning.config.NavigationProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Elevation-mask gate deciding which satellites enter the measurement set.
 *
 * <p>The mask is a single configuration value ({@code navigation.visibility.elevation-mask-deg}).
 * The comparison is strict: a satellite exactly on the mask is rejected.
 */
@Component
public class VisibilityFilter {

    private final double elevationMaskDeg;

    @Autowired
    public VisibilityFilter(NavigationProperties properties) {
        this(properties.getVisibility().getElevationMaskDeg());
    }

    public VisibilityFilter(double elevationMaskDeg) {
        if (!Double.isFinite(elevationMaskDeg) || elevationMaskDeg < -90 || elevationMaskDeg > 90) {
            throw new IllegalArgumentException("Elevation mask must be within [-90, 90] degrees");
        }
        this.elevationMaskDeg = elevationMaskDeg;
    }

    public static boolean isVisible(double elevationDeg, double maskDeg) {
        return elevationDeg > maskDeg;
    }

    /** Applies the configured mask. */
    public boolean isVisible(double elevationDeg) {
        return isVisible(elevationDeg, elevationMaskDeg);
    }

    public double getElevationMaskDeg() {
        return elevationMaskDeg;
    }
}
