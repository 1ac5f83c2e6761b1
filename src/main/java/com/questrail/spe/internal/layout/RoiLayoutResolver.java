package com.questrail.spe.internal.layout;

import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.RawRoi;
import com.questrail.spe.api.ResolvedRoi;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.codec.HeaderFields;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * RoiLayoutResolver
 * =============================================================================
 * Turns the header's raw ROI table into per-region pixel geometry and
 * in-frame byte offsets.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Stored extent is {@code extent / binning} with floor division: pixels
 *       left over by binning are dropped by the camera, never rounded up.</li>
 *   <li>Regions are stored contiguously in declaration order; offsets follow
 *       that order, not sensor position.</li>
 *   <li>Every region must lie inside the sensor.</li>
 *   <li>When the file records a frame stride, the region sizes plus the
 *       tracking block size must equal it exactly.</li>
 * </ul>
 *
 * <h2>Naming</h2>
 * <p>The binary table is authoritative for byte layout. Names come from the
 * metadata document when it provides one for the same index, otherwise the
 * ordinal default {@code "ROI n"} is used. A document name already taken by
 * an earlier region also falls back to the default.</p>
 *
 * All failures are {@link SpeFormatException}s tagged {@link FailureSection#ROI_LAYOUT}.
 */
public final class RoiLayoutResolver
{
    /**
     * Resolves the frame layout.
     *
     * @param header            decoded header
     * @param documentNames     region names from the metadata document, by index;
     *                          entries may be {@code null} and the list may be shorter
     *                          than the ROI table
     * @param trackingBlockSize bytes of the per-frame tracking block, 0 if none
     * @param declaredStride    frame stride recorded by the file, if any
     */
    public FrameLayout resolve(HeaderFields header,
                               List<String> documentNames,
                               int trackingBlockSize,
                               OptionalLong declaredStride) {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(documentNames, "documentNames");
        Objects.requireNonNull(declaredStride, "declaredStride");
        if (trackingBlockSize < 0) {
            throw failure("Negative tracking block size " + trackingBlockSize);
        }

        final int elementWidth = header.dataType().width();
        final List<ResolvedRoi> resolved = new ArrayList<>(header.roiCount());
        final Set<String> usedNames = new HashSet<>();
        long offset = 0;

        for (int i = 0; i < header.roiCount(); i++) {
            final RawRoi raw = header.rois().get(i);
            checkWithinSensor(i, raw, header);

            final int pixelWidth = raw.width() / raw.xBinning();
            final int pixelHeight = raw.height() / raw.yBinning();
            if (pixelWidth <= 0 || pixelHeight <= 0) {
                throw failure(String.format("ROI %d of %dx%d pixels binned %dx%d leaves no stored pixels",
                        i, raw.width(), raw.height(), raw.xBinning(), raw.yBinning()));
            }

            final long byteSize = (long) pixelWidth * pixelHeight * elementWidth;
            String name = nameFor(i, documentNames);
            if (!usedNames.add(name)) {
                name = ResolvedRoi.defaultName(i);
                usedNames.add(name);
            }
            resolved.add(new ResolvedRoi(i, name, raw, pixelWidth, pixelHeight, byteSize, offset));
            offset += byteSize;
        }

        final long stride = offset + trackingBlockSize;
        if (declaredStride.isPresent() && declaredStride.getAsLong() != stride) {
            throw failure(String.format(
                    "ROI sizes (%d bytes) plus tracking block (%d bytes) do not match recorded frame stride %d",
                    offset, trackingBlockSize, declaredStride.getAsLong()));
        }

        return new FrameLayout(resolved, trackingBlockSize, stride, header.dataType());
    }

    private static void checkWithinSensor(int index, RawRoi raw, HeaderFields header) {
        if (raw.originX() < 0 || raw.originY() < 0
                || (long) raw.originX() + raw.width() > header.sensorWidth()
                || (long) raw.originY() + raw.height() > header.sensorHeight()) {
            throw failure(String.format("ROI %d (origin %d,%d extent %dx%d) exceeds sensor %dx%d",
                    index, raw.originX(), raw.originY(), raw.width(), raw.height(),
                    header.sensorWidth(), header.sensorHeight()));
        }
    }

    private static String nameFor(int index, List<String> documentNames) {
        if (index < documentNames.size()) {
            final String name = documentNames.get(index);
            if (name != null && !name.isBlank()) {
                return name.trim();
            }
        }
        return ResolvedRoi.defaultName(index);
    }

    private static SpeFormatException failure(String message) {
        return new SpeFormatException(FailureSection.ROI_LAYOUT, message);
    }
}
