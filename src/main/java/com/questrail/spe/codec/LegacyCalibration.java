package com.questrail.spe.codec;

import java.util.List;

/**
 * The x-axis calibration structure of a legacy header, as stored.
 *
 * <p>No validation is applied here; the metadata unifier decides whether the
 * values form a usable calibration.</p>
 *
 * @param valid           the header's {@code calib_valid} flag
 * @param polynomialOrder the header's {@code polynom_order}
 * @param coefficients    all stored coefficients, lowest order first
 * @param label           free-text calibration label
 */
public record LegacyCalibration(boolean valid, int polynomialOrder, List<Double> coefficients, String label)
{
    public LegacyCalibration {
        coefficients = List.copyOf(coefficients);
    }
}
