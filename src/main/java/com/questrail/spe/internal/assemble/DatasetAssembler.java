package com.questrail.spe.internal.assemble;

import com.questrail.spe.api.Calibration;
import com.questrail.spe.api.Coordinate;
import com.questrail.spe.api.DataArray;
import com.questrail.spe.api.Dataset;
import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.FrameTrackFieldSpec;
import com.questrail.spe.api.Metadata;
import com.questrail.spe.api.ResolvedRoi;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.api.Tensor;
import com.questrail.spe.internal.frame.Frame;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DatasetAssembler
 * =============================================================================
 * Collects decoded frames and builds the final {@link Dataset}.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>Created once per decode with the unified {@link Metadata}.</li>
 *   <li>{@link #accept(Frame)} is called once per frame, in any order; each
 *       frame's region bytes are copied into place.</li>
 *   <li>{@link #assemble()} builds one {@code (frame, y, x)} array per region,
 *       attaches coordinates and returns the dataset.</li>
 * </ol>
 *
 * <h2>Coordinates</h2>
 * <ul>
 *   <li>{@code x}, {@code y}: sensor position of each binned pixel center,
 *       {@code origin + i * binning + binning / 2}.</li>
 *   <li>{@code frame}: frame index.</li>
 *   <li>Calibration (when enabled): see {@link CalibrationAxis}.</li>
 *   <li>Tracking: one series per field, along {@code frame}, shared by every
 *       region.</li>
 * </ul>
 *
 * <p>Instances are confined to the calling thread; {@code accept} is not
 * synchronised.</p>
 */
public final class DatasetAssembler
{
    private final Metadata metadata;
    private final boolean withCalibration;
    private final List<byte[]> regionData;
    private final Map<String, double[]> trackingSeries = new LinkedHashMap<>();
    private final boolean[] received;
    private int receivedCount;

    public DatasetAssembler(Metadata metadata, boolean withCalibration) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.withCalibration = withCalibration;
        this.regionData = new ArrayList<>(metadata.rois().size());
        for (ResolvedRoi roi : metadata.rois()) {
            final int frames = metadata.frameCount();
            if (frames > 0 && roi.byteSize() > (Integer.MAX_VALUE - 8) / frames) {
                throw new SpeFormatException(FailureSection.FRAME_DATA, String.format(
                        "Region '%s' holds %d bytes per frame over %d frame(s), more than one array can hold",
                        roi.name(), roi.byteSize(), frames));
            }
            regionData.add(new byte[(int) (roi.byteSize() * frames)]);
        }
        metadata.tracking().ifPresent(layout -> {
            for (FrameTrackFieldSpec field : layout.fields()) {
                trackingSeries.put(field.name(), new double[metadata.frameCount()]);
            }
        });
        this.received = new boolean[metadata.frameCount()];
    }

    /**
     * Copies one frame into place.
     *
     * @throws IllegalStateException if the frame does not fit the layout or was already accepted
     */
    public void accept(Frame frame) {
        Objects.requireNonNull(frame, "frame");
        final int index = frame.index();
        if (index < 0 || index >= received.length) {
            throw new IllegalStateException("Frame " + index + " outside 0.." + (received.length - 1));
        }
        if (received[index]) {
            throw new IllegalStateException("Frame " + index + " accepted twice");
        }
        if (frame.roiBlocks().size() != metadata.rois().size()) {
            throw new IllegalStateException("Frame " + index + " has " + frame.roiBlocks().size()
                    + " region block(s), layout has " + metadata.rois().size());
        }

        for (int r = 0; r < metadata.rois().size(); r++) {
            final ResolvedRoi roi = metadata.rois().get(r);
            final ByteBuffer block = frame.roiBlocks().get(r).duplicate();
            if (block.remaining() != roi.byteSize()) {
                throw new IllegalStateException("Region '" + roi.name() + "' of frame " + index + " holds "
                        + block.remaining() + " bytes, expected " + roi.byteSize());
            }
            block.get(regionData.get(r), (int) (index * roi.byteSize()), (int) roi.byteSize());
        }

        for (Map.Entry<String, double[]> series : trackingSeries.entrySet()) {
            final Double value = frame.trackingValues().get(series.getKey());
            if (value == null) {
                throw new IllegalStateException("Frame " + index + " lacks tracking value " + series.getKey());
            }
            series.getValue()[index] = value;
        }

        received[index] = true;
        receivedCount++;
    }

    /**
     * Builds the dataset.
     *
     * @throws IllegalStateException if frames are missing or dimensions disagree
     */
    public Dataset assemble() {
        if (receivedCount != received.length) {
            throw new IllegalStateException("Received " + receivedCount + " of " + received.length + " frame(s)");
        }

        final List<DataArray> arrays = new ArrayList<>(metadata.rois().size());
        for (int r = 0; r < metadata.rois().size(); r++) {
            final ResolvedRoi roi = metadata.rois().get(r);
            final Tensor data = Tensor.of(metadata.pixelType(),
                    new int[] {metadata.frameCount(), roi.pixelHeight(), roi.pixelWidth()},
                    regionData.get(r));
            arrays.add(new DataArray(roi.name(), roi, data, coordinates(roi)));
        }
        return new Dataset(arrays, metadata);
    }

    private Map<String, Coordinate> coordinates(ResolvedRoi roi) {
        final Map<String, Coordinate> coordinates = new LinkedHashMap<>();
        coordinates.put(DataArray.FRAME, new Coordinate(DataArray.FRAME, DataArray.FRAME, frameIndices()));
        coordinates.put(DataArray.Y, new Coordinate(DataArray.Y, DataArray.Y,
                pixelCenters(roi.geometry().originY(), roi.geometry().yBinning(), roi.pixelHeight())));
        coordinates.put(DataArray.X, new Coordinate(DataArray.X, DataArray.X,
                pixelCenters(roi.geometry().originX(), roi.geometry().xBinning(), roi.pixelWidth())));

        if (withCalibration) {
            final Optional<Calibration> calibration = CalibrationAxis.select(metadata.calibrations(), roi.index());
            calibration.ifPresent(c -> {
                final Coordinate values = CalibrationAxis.of(c, metadata.sensorOrientation()).evaluate(roi);
                if (coordinates.containsKey(values.name())) {
                    throw new IllegalStateException("Calibration name '" + values.name()
                            + "' collides with an existing coordinate");
                }
                coordinates.put(values.name(), values);
            });
        }

        for (Map.Entry<String, double[]> series : trackingSeries.entrySet()) {
            if (coordinates.containsKey(series.getKey())) {
                throw new IllegalStateException("Tracking field '" + series.getKey()
                        + "' collides with an existing coordinate");
            }
            coordinates.put(series.getKey(), new Coordinate(series.getKey(), DataArray.FRAME, series.getValue()));
        }
        return coordinates;
    }

    private double[] frameIndices() {
        final double[] values = new double[metadata.frameCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        return values;
    }

    static double[] pixelCenters(int origin, int binning, int count) {
        final double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = origin + (long) i * binning + binning / 2;
        }
        return values;
    }
}
