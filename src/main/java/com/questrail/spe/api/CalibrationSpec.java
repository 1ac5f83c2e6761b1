package com.questrail.spe.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Polynomial calibration: {@code value(p) = sum(coefficients[i] * p^i)}.
 *
 * <p>No monotonicity is assumed. Evaluation over a region uses the region's
 * local pixel index offset by {@code referencePixel}.</p>
 */
public record CalibrationSpec(
        String name,
        String unit,
        List<Double> coefficients,
        int referencePixel,
        Optional<Integer> roiIndex,
        Orientation orientation
) implements Calibration
{
    public CalibrationSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(unit, "unit");
        coefficients = List.copyOf(coefficients);
        Objects.requireNonNull(roiIndex, "roiIndex");
        Objects.requireNonNull(orientation, "orientation");
    }

    /**
     * Evaluates the polynomial at {@code pixelIndex} (Horner's scheme).
     */
    public double value(double pixelIndex) {
        double result = 0.0;
        for (int i = coefficients.size() - 1; i >= 0; i--) {
            result = result * pixelIndex + coefficients.get(i);
        }
        return result;
    }
}
