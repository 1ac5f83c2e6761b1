package com.questrail.spe.codec;

import com.questrail.spe.api.FileVersion;
import com.questrail.spe.api.NumericType;
import com.questrail.spe.api.RawRoi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * HeaderFields
 * -----------------------------------------------------------------------------
 * Immutable, version-tagged result of decoding the fixed SPE header.
 *
 * <p>Produced once per open by {@link BinaryHeaderDecoder}. Version-specific
 * fields are optional: the metadata document offset exists only for
 * {@link FileVersion#MODERN} files and the calibration structure only for
 * {@link FileVersion#LEGACY} files.</p>
 *
 * @param version           detected revision
 * @param headerVersion     raw {@code file_header_ver}
 * @param frameCount        number of stored frames, never negative
 * @param sensorWidth       sensor width in pixels, positive
 * @param sensorHeight      sensor height in pixels, positive
 * @param dataType          pixel element kind
 * @param rois              ROI table entries in declaration order
 * @param metadataOffset    byte offset of the metadata document (modern only)
 * @param legacyCalibration stored x calibration (legacy only)
 * @param generalInfo       descriptive header values (date, exposure, ...)
 */
public record HeaderFields(
        FileVersion version,
        float headerVersion,
        int frameCount,
        int sensorWidth,
        int sensorHeight,
        NumericType dataType,
        List<RawRoi> rois,
        OptionalLong metadataOffset,
        Optional<LegacyCalibration> legacyCalibration,
        Map<String, String> generalInfo
) {
    public HeaderFields {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(dataType, "dataType");
        rois = List.copyOf(rois);
        Objects.requireNonNull(metadataOffset, "metadataOffset");
        Objects.requireNonNull(legacyCalibration, "legacyCalibration");
        generalInfo = Collections.unmodifiableMap(new LinkedHashMap<>(generalInfo));
    }

    public int roiCount() {
        return rois.size();
    }
}
