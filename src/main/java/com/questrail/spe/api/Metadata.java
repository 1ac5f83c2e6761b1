package com.questrail.spe.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Metadata
 * -----------------------------------------------------------------------------
 * Version-independent, validated description of an SPE file.
 *
 * <p>A {@code Metadata} instance is produced once per decode by merging the
 * binary header with the (optional) metadata document. It is immutable and is
 * shared by every region of the resulting {@link Dataset}.</p>
 *
 * <h2>Optional subtrees</h2>
 * <p>Tracking layout is modelled as an explicit {@link Optional}: absence means
 * the file carries no per-frame tracking block, which is always the case for
 * {@link FileVersion#LEGACY} files. Calibrations and general information are
 * possibly-empty collections.</p>
 *
 * @param version             detected file revision
 * @param frameCount          number of frames stored in the file
 * @param sensorWidth         full sensor width in pixels
 * @param sensorHeight        full sensor height in pixels
 * @param pixelType           element kind of stored pixel data
 * @param frameStride         bytes per frame block (all regions plus tracking block)
 * @param generalInfo         descriptive key/value passthrough
 * @param calibrations        calibrations in document (or header) order
 * @param rois                resolved regions in declaration order
 * @param tracking            per-frame tracking layout, if present
 * @param sensorOrientation   orientation of the stored data
 * @param unsupportedFeatures recognised structures that were omitted
 */
public record Metadata(
        FileVersion version,
        int frameCount,
        int sensorWidth,
        int sensorHeight,
        NumericType pixelType,
        long frameStride,
        Map<String, String> generalInfo,
        List<Calibration> calibrations,
        List<ResolvedRoi> rois,
        Optional<TrackingLayout> tracking,
        Orientation sensorOrientation,
        List<UnsupportedFeature> unsupportedFeatures
) {
    public Metadata {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(pixelType, "pixelType");
        generalInfo = Collections.unmodifiableMap(new LinkedHashMap<>(generalInfo));
        calibrations = List.copyOf(calibrations);
        rois = List.copyOf(rois);
        Objects.requireNonNull(tracking, "tracking");
        Objects.requireNonNull(sensorOrientation, "sensorOrientation");
        unsupportedFeatures = List.copyOf(unsupportedFeatures);

        if (version == FileVersion.LEGACY && tracking.isPresent()) {
            throw new IllegalArgumentException("Legacy files never carry tracking data");
        }
    }

    /**
     * Returns the size of the per-frame tracking block, or 0 if there is none.
     */
    public int trackingBlockSize() {
        return tracking.map(TrackingLayout::blockSize).orElse(0);
    }

    /**
     * Looks up a region by name.
     */
    public Optional<ResolvedRoi> roi(String name) {
        return rois.stream().filter(r -> r.name().equals(name)).findFirst();
    }
}
