package com.questrail.spe.api;

import java.util.Objects;

/**
 * ResolvedRoi
 * -----------------------------------------------------------------------------
 * Pixel geometry and in-frame byte placement of one region of interest.
 *
 * <p>{@code byteOffset} is relative to the start of a frame block. Regions are
 * stored back to back in declaration order, which is not necessarily their
 * spatial order on the sensor.</p>
 *
 * @param index       0-based declaration index
 * @param name        document-provided name, or {@code "ROI n"}
 * @param geometry    the header entry this region was resolved from
 * @param pixelWidth  stored width after binning
 * @param pixelHeight stored height after binning
 * @param byteSize    bytes occupied by this region within one frame
 * @param byteOffset  offset of this region from the start of a frame block
 */
public record ResolvedRoi(
        int index,
        String name,
        RawRoi geometry,
        int pixelWidth,
        int pixelHeight,
        long byteSize,
        long byteOffset
) {
    public ResolvedRoi {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(geometry, "geometry");
        if (pixelWidth <= 0 || pixelHeight <= 0) {
            throw new IllegalArgumentException("ROI pixel extent must be positive: " + pixelWidth + "x" + pixelHeight);
        }
    }

    public static String defaultName(int index) {
        return "ROI " + index;
    }
}
