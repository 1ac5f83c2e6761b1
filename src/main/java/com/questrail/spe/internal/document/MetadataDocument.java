package com.questrail.spe.internal.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MetadataDocument
 * -----------------------------------------------------------------------------
 * The subtrees extracted from a modern file's trailing metadata document.
 *
 * <p>Every subtree is an explicit {@link Optional}. Absence of a subtree is
 * never an error at this level; it is up to the metadata unifier to decide
 * what a missing subtree means for a given file revision.</p>
 *
 * <p>Values are raw strings. Typing and range checks happen in the unifier so
 * that all violations can be reported together.</p>
 *
 * @param frameFormat      frame and region descriptors ({@code DataFormat})
 * @param trackingLayout   tracking fields ({@code MetaFormat/MetaBlock}), present only when non-empty
 * @param calibrations     calibration subtree ({@code Calibrations})
 * @param generalInfo      flattened {@code GeneralInformation} passthrough
 * @param ignoredSections  element paths skipped as unrecognised
 */
public record MetadataDocument(
        Optional<RawFrameFormat> frameFormat,
        Optional<List<RawTrackField>> trackingLayout,
        Optional<RawCalibrations> calibrations,
        Optional<Map<String, String>> generalInfo,
        List<String> ignoredSections
) {
    private static final MetadataDocument ABSENT = new MetadataDocument(
            Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), List.of());

    public MetadataDocument {
        Objects.requireNonNull(frameFormat, "frameFormat");
        trackingLayout = trackingLayout.map(List::copyOf);
        Objects.requireNonNull(calibrations, "calibrations");
        generalInfo = generalInfo.map(info -> Collections.unmodifiableMap(new LinkedHashMap<>(info)));
        ignoredSections = List.copyOf(ignoredSections);
    }

    /**
     * The document of a file that has none (every legacy file).
     */
    public static MetadataDocument absent() {
        return ABSENT;
    }

    public boolean isAbsent() {
        return frameFormat.isEmpty() && trackingLayout.isEmpty() && calibrations.isEmpty() && generalInfo.isEmpty();
    }
}
