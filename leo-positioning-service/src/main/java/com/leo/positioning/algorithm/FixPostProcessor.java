package com.leo.positioning.algorithm;

import com.leo.positioning.algorithm.util.GeodeticTransform;
import com.leo.positioning.dto.Fix;
import com.leo.positioning.dto.FixMode;
import com.leo.positioning.dto.GeodeticCoordinate;
import com.leo.positioning.dto.StateEstimate;
import org.springframework.stereotype.Component;

/**
 * Turns a raw solver estimate into a published {@link Fix}. The clock bias is not part of the fix.
 *
 * <p>The latitude and longitude may be blended toward a reference coordinate:
 *
 * <pre>
 *   lat = ref.lat + w·(raw.lat − ref.lat)
 *   lon = ref.lon + w·(raw.lon − ref.lon)
 * </pre>
 *
 * <p>With w = 1 the raw solver position is published unchanged. The error figure is a planar
 * approximation at 111 000 m per degree on both axes, scored against the reference.
 */
@Component
public class FixPostProcessor {

    // ============================================================================
    // ERROR APPROXIMATION CONSTANTS
    // ============================================================================

    /** Metres per degree used on both axes; not corrected for cos(latitude). */
    public static final double METERS_PER_DEGREE = 111_000.0;

    /**
     * Builds a fix from a raw solver estimate.
     *
     * @param raw solver state; only its ECEF position is used
     * @param reference reference coordinate the error is scored against
     * @param blendWeight weight of the raw position, within [0, 1]
     * @param mode fix mode to stamp on the result
     * @return the fix; altitude is the solver's own altitude
     * @throws IllegalArgumentException if the weight is outside [0, 1]
     */
    public Fix postprocess(
            StateEstimate raw, GeodeticCoordinate reference, double blendWeight, FixMode mode) {
        if (!(blendWeight >= 0.0 && blendWeight <= 1.0)) {
            throw new IllegalArgumentException("Blend weight must be within [0, 1]");
        }

        GeodeticCoordinate solved = GeodeticTransform.inverse(raw.position());
        double lat = reference.latitudeDeg()
            + blendWeight * (solved.latitudeDeg() - reference.latitudeDeg());
        double lon = reference.longitudeDeg()
            + blendWeight * (solved.longitudeDeg() - reference.longitudeDeg());

        return new Fix(lat, lon, solved.altitudeM(), errorMeters(lat, lon, reference), mode);
    }

    /** Post-processes with {@link FixMode#THREE_D_LOCK}. */
    public Fix postprocess(StateEstimate raw, GeodeticCoordinate reference, double blendWeight) {
        return postprocess(raw, reference, blendWeight, FixMode.THREE_D_LOCK);
    }

    static double errorMeters(double lat, double lon, GeodeticCoordinate reference) {
        double dLat = (lat - reference.latitudeDeg()) * METERS_PER_DEGREE;
        double dLon = (lon - reference.longitudeDeg()) * METERS_PER_DEGREE;
        return Math.sqrt(dLat * dLat + dLon * dLon);
    }
}
