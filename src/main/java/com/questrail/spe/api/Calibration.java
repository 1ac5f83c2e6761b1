package com.questrail.spe.api;

import java.util.Optional;

/**
 * A mapping from pixel position to a physical unit, typically wavelength.
 *
 * <p>Calibrations are either scoped to a single region of interest or shared
 * by all of them. Each records the sensor orientation in effect when it was
 * taken, so that it can be mapped onto the orientation of the stored data.</p>
 */
public sealed interface Calibration permits CalibrationSpec, TabulatedCalibration
{
    /**
     * Coordinate name under which the calibrated values are published.
     */
    String name();

    String unit();

    /**
     * Index of the region this calibration applies to, or empty when shared.
     */
    Optional<Integer> roiIndex();

    Orientation orientation();
}
