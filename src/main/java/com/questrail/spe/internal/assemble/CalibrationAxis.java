package com.questrail.spe.internal.assemble;

import com.questrail.spe.api.Calibration;
import com.questrail.spe.api.CalibrationSpec;
import com.questrail.spe.api.Coordinate;
import com.questrail.spe.api.DataArray;
import com.questrail.spe.api.Orientation;
import com.questrail.spe.api.ResolvedRoi;
import com.questrail.spe.api.TabulatedCalibration;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CalibrationAxis
 * -----------------------------------------------------------------------------
 * Places a calibration on one spatial axis of a region and evaluates it.
 *
 * <h2>Axis</h2>
 * <p>The calibration's recorded orientation is mapped onto the orientation of
 * the stored data. When the mapping rotates, the calibration runs along
 * {@code y}, otherwise along {@code x}. A horizontal flip in the mapping
 * reverses the evaluated values.</p>
 *
 * <h2>Evaluation</h2>
 * <ul>
 *   <li>{@link CalibrationSpec}: {@code value(referencePixel + p)} for each
 *       stored pixel {@code p} of the region along the axis.</li>
 *   <li>{@link TabulatedCalibration}: the table entry at the sensor pixel under
 *       the center of each binned pixel, {@code origin + p * bin + bin / 2}.</li>
 * </ul>
 */
public final class CalibrationAxis
{
    private final Calibration calibration;
    private final String dimension;
    private final boolean reversed;

    private CalibrationAxis(Calibration calibration, String dimension, boolean reversed) {
        this.calibration = calibration;
        this.dimension = dimension;
        this.reversed = reversed;
    }

    /**
     * Places {@code calibration} on data stored in {@code sensorOrientation}.
     */
    public static CalibrationAxis of(Calibration calibration, Orientation sensorOrientation) {
        Objects.requireNonNull(calibration, "calibration");
        final Orientation mapping = calibration.orientation().mappingTo(sensorOrientation);
        return new CalibrationAxis(calibration, mapping.rotate() ? DataArray.Y : DataArray.X, mapping.flipHorizontal());
    }

    /**
     * Picks the calibration for a region: the first one scoped to it, otherwise
     * the first shared one.
     */
    public static Optional<Calibration> select(List<Calibration> calibrations, int roiIndex) {
        final Optional<Calibration> scoped = calibrations.stream()
                .filter(c -> c.roiIndex().isPresent() && c.roiIndex().get() == roiIndex)
                .findFirst();
        if (scoped.isPresent()) {
            return scoped;
        }
        return calibrations.stream().filter(c -> c.roiIndex().isEmpty()).findFirst();
    }

    public String dimension() {
        return dimension;
    }

    public boolean reversed() {
        return reversed;
    }

    /**
     * Number of table entries a tabulated calibration needs to cover {@code roi}.
     */
    public int requiredTableLength(ResolvedRoi roi) {
        final int extent = extent(roi);
        return origin(roi) + (extent - 1) * binning(roi) + binning(roi) / 2 + 1;
    }

    /**
     * Evaluates the calibration over {@code roi}.
     *
     * @throws IndexOutOfBoundsException if a table does not cover the region
     */
    public Coordinate evaluate(ResolvedRoi roi) {
        final int extent = extent(roi);
        final double[] values = new double[extent];
        for (int p = 0; p < extent; p++) {
            values[p] = valueAt(roi, p);
        }
        if (reversed) {
            for (int i = 0, j = extent - 1; i < j; i++, j--) {
                final double tmp = values[i];
                values[i] = values[j];
                values[j] = tmp;
            }
        }
        return new Coordinate(calibration.name(), dimension, values);
    }

    private double valueAt(ResolvedRoi roi, int pixel) {
        if (calibration instanceof CalibrationSpec polynomial) {
            return polynomial.value(polynomial.referencePixel() + pixel);
        }
        final TabulatedCalibration table = (TabulatedCalibration) calibration;
        return table.valueAt(origin(roi) + pixel * binning(roi) + binning(roi) / 2);
    }

    private int extent(ResolvedRoi roi) {
        return DataArray.Y.equals(dimension) ? roi.pixelHeight() : roi.pixelWidth();
    }

    private int origin(ResolvedRoi roi) {
        return DataArray.Y.equals(dimension) ? roi.geometry().originY() : roi.geometry().originX();
    }

    private int binning(ResolvedRoi roi) {
        return DataArray.Y.equals(dimension) ? roi.geometry().yBinning() : roi.geometry().xBinning();
    }
}
