package com.questrail.spe.api;

/**
 * A region of interest exactly as recorded in the binary header, converted
 * from the file's 1-based inclusive bounds to a 0-based origin and extent.
 *
 * <p>Extents are in sensor pixels, before binning.</p>
 */
public record RawRoi(
        int originX,
        int originY,
        int width,
        int height,
        int xBinning,
        int yBinning
) {
    /**
     * Builds a region from header bounds ({@code startx..endx}, {@code starty..endy},
     * both inclusive and 1-based).
     */
    public static RawRoi fromBounds(int startX, int endX, int groupX, int startY, int endY, int groupY) {
        return new RawRoi(startX - 1, startY - 1, endX - startX + 1, endY - startY + 1, groupX, groupY);
    }
}
