package com.questrail.spe.codec;

import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.FileVersion;
import com.questrail.spe.api.NumericType;
import com.questrail.spe.api.RawRoi;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.io.ByteSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * BinaryHeaderDecoder
 * -----------------------------------------------------------------------------
 * Reads the fixed {@value HeaderLayout#HEADER_SIZE}-byte header region into
 * {@link HeaderFields}.
 *
 * <p>The decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Read the whole header region (a short file is a structural error)</li>
 *   <li>Read {@code file_header_ver} and select the {@link HeaderLayout}</li>
 *   <li>In strict mode, check the legacy sentinel values</li>
 *   <li>Read and validate dimensions, data type and the ROI table</li>
 *   <li>Read version-specific fields</li>
 * </ol>
 *
 * <p>Every failure is reported as a {@link SpeFormatException} tagged
 * {@link FailureSection#HEADER}. The decoder never mutates the source.</p>
 */
public final class BinaryHeaderDecoder
{
    private final boolean strict;
    private final int maxRoiCount;

    /**
     * @param strict      check the {@code lnoscan}, {@code WinView_id} and
     *                    {@code lastvalue} sentinels
     * @param maxRoiCount defensive upper bound on the declared ROI count
     */
    public BinaryHeaderDecoder(boolean strict, int maxRoiCount) {
        if (maxRoiCount < 1 || maxRoiCount > HeaderLayout.ROI_TABLE_CAPACITY) {
            throw new IllegalArgumentException("maxRoiCount must be 1.." + HeaderLayout.ROI_TABLE_CAPACITY);
        }
        this.strict = strict;
        this.maxRoiCount = maxRoiCount;
    }

    /**
     * Decodes the header of {@code source}.
     *
     * @throws SpeFormatException if the header is structurally invalid
     * @throws IOException        if the source cannot be read
     */
    public HeaderFields decode(ByteSource source) throws IOException {
        Objects.requireNonNull(source, "source");

        final long fileSize = source.size();
        final ByteBuffer header = ByteBuffer.allocate(HeaderLayout.HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        final int read = source.readFully(0, header);
        if (read < HeaderLayout.HEADER_SIZE) {
            throw failure("File holds " + read + " bytes, shorter than the "
                    + HeaderLayout.HEADER_SIZE + "-byte header");
        }

        // 1) Version first: it selects the field table.
        final float headerVersion = (float) HeaderLayout.VERSION_SLOT.readDouble(header);
        final FileVersion version = FileVersion.fromHeaderVersion(headerVersion)
                .orElseThrow(() -> failure("Unrecognized header version " + headerVersion));
        final HeaderLayout layout = HeaderLayout.forVersion(version);

        // 2) Sentinels
        if (strict) {
            checkSentinel(layout, header, HeaderField.LNOSCAN, HeaderLayout.LNOSCAN_SENTINEL);
            checkSentinel(layout, header, HeaderField.WINVIEW_ID, HeaderLayout.WINVIEW_ID_SENTINEL);
            checkSentinel(layout, header, HeaderField.LAST_VALUE, HeaderLayout.LAST_VALUE_SENTINEL);
        }

        // 3) Dimensions and element type
        final int sensorWidth = (int) layout.require(HeaderField.SENSOR_WIDTH).readLong(header);
        final int sensorHeight = (int) layout.require(HeaderField.SENSOR_HEIGHT).readLong(header);
        if (sensorWidth <= 0 || sensorHeight <= 0) {
            throw failure("Invalid sensor dimensions " + sensorWidth + "x" + sensorHeight);
        }

        final int frameCount = (int) layout.require(HeaderField.FRAME_COUNT).readLong(header);
        if (frameCount < 0) {
            throw failure("Invalid frame count " + frameCount);
        }

        final int dataTypeCode = (int) layout.require(HeaderField.DATA_TYPE).readLong(header);
        final NumericType dataType = NumericType.fromDataTypeCode(dataTypeCode)
                .orElseThrow(() -> failure("Unsupported pixel data type code " + dataTypeCode));

        final List<RawRoi> rois = readRoiTable(layout, header);

        // 4) Version-specific fields
        final OptionalLong metadataOffset = readMetadataOffset(layout, header, fileSize);
        final Optional<LegacyCalibration> calibration = readLegacyCalibration(layout, header);

        return new HeaderFields(
                version,
                headerVersion,
                frameCount,
                sensorWidth,
                sensorHeight,
                dataType,
                rois,
                metadataOffset,
                calibration,
                readGeneralInfo(layout, header));
    }

    private List<RawRoi> readRoiTable(HeaderLayout layout, ByteBuffer header) {
        final int roiCount = (int) layout.require(HeaderField.ROI_COUNT).readLong(header);
        if (roiCount <= 0 || roiCount > maxRoiCount) {
            throw failure("ROI count " + roiCount + " outside 1.." + maxRoiCount);
        }

        final FieldSlot table = layout.require(HeaderField.ROI_TABLE);
        final List<RawRoi> rois = new ArrayList<>(roiCount);
        for (int i = 0; i < roiCount; i++) {
            final int base = i * HeaderLayout.ROI_ENTRY_FIELDS;
            final int startX = (int) table.readLong(header, base);
            final int endX = (int) table.readLong(header, base + 1);
            final int groupX = (int) table.readLong(header, base + 2);
            final int startY = (int) table.readLong(header, base + 3);
            final int endY = (int) table.readLong(header, base + 4);
            final int groupY = (int) table.readLong(header, base + 5);

            if (startX < 1 || endX < startX || startY < 1 || endY < startY) {
                throw failure(String.format("ROI %d has invalid bounds x=%d..%d y=%d..%d",
                        i, startX, endX, startY, endY));
            }
            if (groupX < 1 || groupY < 1) {
                throw failure(String.format("ROI %d has invalid binning %dx%d", i, groupX, groupY));
            }
            rois.add(RawRoi.fromBounds(startX, endX, groupX, startY, endY, groupY));
        }
        return rois;
    }

    private static OptionalLong readMetadataOffset(HeaderLayout layout, ByteBuffer header, long fileSize) {
        final Optional<FieldSlot> slot = layout.slot(HeaderField.XML_OFFSET);
        if (slot.isEmpty()) {
            return OptionalLong.empty();
        }
        final long offset = slot.get().readLong(header);
        if (offset == 0) {
            // Writer did not record a document.
            return OptionalLong.empty();
        }
        if (offset < HeaderLayout.HEADER_SIZE || offset >= fileSize) {
            throw failure("Metadata document offset " + Long.toUnsignedString(offset)
                    + " lies outside " + HeaderLayout.HEADER_SIZE + ".." + fileSize);
        }
        return OptionalLong.of(offset);
    }

    private static Optional<LegacyCalibration> readLegacyCalibration(HeaderLayout layout, ByteBuffer header) {
        final Optional<FieldSlot> coefficientsSlot = layout.slot(HeaderField.CALIBRATION_COEFFICIENTS);
        if (coefficientsSlot.isEmpty()) {
            return Optional.empty();
        }
        final FieldSlot slot = coefficientsSlot.get();
        final List<Double> coefficients = new ArrayList<>(slot.count());
        for (int i = 0; i < slot.count(); i++) {
            coefficients.add(slot.readDouble(header, i));
        }
        return Optional.of(new LegacyCalibration(
                layout.require(HeaderField.CALIBRATION_VALID).readLong(header) != 0,
                (int) layout.require(HeaderField.CALIBRATION_POLYNOMIAL_ORDER).readLong(header),
                coefficients,
                layout.require(HeaderField.CALIBRATION_LABEL).readText(header)));
    }

    private static Map<String, String> readGeneralInfo(HeaderLayout layout, ByteBuffer header) {
        final Map<String, String> info = new LinkedHashMap<>();
        info.put("headerVersion", Float.toString((float) layout.require(HeaderField.HEADER_VERSION).readDouble(header)));
        putText(info, "date", layout, header, HeaderField.DATE);
        putText(info, "experimentTimeLocal", layout, header, HeaderField.EXPERIMENT_TIME_LOCAL);
        putText(info, "experimentTimeUTC", layout, header, HeaderField.EXPERIMENT_TIME_UTC);
        info.put("exposure", Float.toString((float) layout.require(HeaderField.EXPOSURE).readDouble(header)));
        info.put("detectorTemperature",
                Float.toString((float) layout.require(HeaderField.DETECTOR_TEMPERATURE).readDouble(header)));
        info.put("geometric", Long.toString(layout.require(HeaderField.GEOMETRIC).readLong(header)));
        // Stored frame size as the writer saw it; the ROI table governs layout.
        info.put("storedWidth", Long.toString(layout.require(HeaderField.STORED_WIDTH).readLong(header)));
        info.put("storedHeight", Long.toString(layout.require(HeaderField.STORED_HEIGHT).readLong(header)));
        return info;
    }

    private static void putText(Map<String, String> info, String key,
                                HeaderLayout layout, ByteBuffer header, HeaderField field) {
        final String value = layout.require(field).readText(header);
        if (!value.isEmpty()) {
            info.put(key, value);
        }
    }

    private static void checkSentinel(HeaderLayout layout, ByteBuffer header, HeaderField field, long expected) {
        final long actual = layout.require(field).readLong(header);
        if (actual != expected) {
            throw failure("Unrecognized magic: " + field + " is 0x" + Long.toHexString(actual)
                    + ", expected 0x" + Long.toHexString(expected));
        }
    }

    private static SpeFormatException failure(String message) {
        return new SpeFormatException(FailureSection.HEADER, message);
    }
}
