package com.leo.positioning.algorithm;

import com.leo.positioning.algorithm.util.GeodeticTransform;
import com.leo.positioning.dto.EcefCoordinate;
import com.leo.positioning.dto.Measurement;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Produces synthetic pseudoranges from true geometry.
 *
 * <p>Measurement model:
 *
 * <pre>
 *   ρ = ‖s − r‖ + b + ε,   ε ~ U(−η, +η)
 * </pre>
 *
 * <p>where s is the satellite position, r the true receiver position, b the receiver clock bias
 * shared by every satellite in the cycle and η the noise bound. One independent draw per call.
 * Requiring b ≥ η keeps every pseudorange at or above the geometric range.
 */
@Component
public class MeasurementSynthesizer {

    private final Random random;

    public MeasurementSynthesizer(Random random) {
        this.random = random;
    }

    /**
     * Synthesizes one pseudorange.
     *
     * @param satellitePosition satellite ECEF position, km
     * @param truthPosition true receiver ECEF position, km
     * @param clockBiasKm common receiver clock bias expressed as range, km
     * @param noiseBoundKm half-width of the uniform noise, km
     * @return the measurement
     * @throws IllegalArgumentException if the bias or bound is negative, non-finite, or the bias is
     *     smaller than the bound
     */
    public Measurement synthesize(
            EcefCoordinate satellitePosition,
            EcefCoordinate truthPosition,
            double clockBiasKm,
            double noiseBoundKm) {
        if (!Double.isFinite(noiseBoundKm) || noiseBoundKm < 0) {
            throw new IllegalArgumentException("Noise bound must be a non-negative finite number");
        }
        if (!Double.isFinite(clockBiasKm) || clockBiasKm < noiseBoundKm) {
            throw new IllegalArgumentException(
                "Clock bias must be finite and not smaller than the noise bound");
        }

        double geometricRange = GeodeticTransform.slantRangeKm(satellitePosition, truthPosition);
        double noise = noiseBoundKm == 0.0 ? 0.0 : (2.0 * random.nextDouble() - 1.0) * noiseBoundKm;
        return new Measurement(satellitePosition, geometricRange + clockBiasKm + noise);
    }
}
