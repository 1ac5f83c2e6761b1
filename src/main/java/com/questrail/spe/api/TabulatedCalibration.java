package com.questrail.spe.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Calibration given as one value per sensor column (or row, once rotated).
 */
public record TabulatedCalibration(
        String name,
        String unit,
        List<Double> values,
        Optional<Integer> roiIndex,
        Orientation orientation
) implements Calibration
{
    public TabulatedCalibration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(unit, "unit");
        values = List.copyOf(values);
        Objects.requireNonNull(roiIndex, "roiIndex");
        Objects.requireNonNull(orientation, "orientation");
    }

    /**
     * Returns the calibrated value of the given sensor pixel.
     *
     * @throws IndexOutOfBoundsException if the table does not cover the pixel
     */
    public double valueAt(int sensorPixel) {
        return values.get(sensorPixel);
    }
}
