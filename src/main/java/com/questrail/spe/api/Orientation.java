package com.questrail.spe.api;

/**
 * Sensor orientation expressed as the atomic operations that produce it.
 *
 * <p>Flips are applied first, then the optional clockwise rotation. This order
 * gives all eight orientations reachable by flipping and rotating a sensor
 * image, and matches the order the acquisition software uses.</p>
 *
 * @param flipHorizontal the x axis is reversed
 * @param flipVertical   the y axis is reversed
 * @param rotate         the image is rotated clockwise by 90 degrees
 */
public record Orientation(boolean flipHorizontal, boolean flipVertical, boolean rotate)
{
    public static final Orientation NORMAL = new Orientation(false, false, false);

    /**
     * Parses an orientation label such as {@code "Normal"},
     * {@code "FlipHorizontal"} or {@code "FlipVertical,Rotate90"}.
     * Unknown labels parse as {@link #NORMAL}.
     */
    public static Orientation parse(String label) {
        if (label == null) {
            return NORMAL;
        }
        return new Orientation(label.contains("Horiz"), label.contains("Vert"), label.contains("Rot"));
    }

    /**
     * Returns the operations that map data taken in this orientation onto
     * {@code target}. Flips combine by exclusive or; rotation is needed only when
     * the two orientations disagree on it.
     */
    public Orientation mappingTo(Orientation target) {
        return new Orientation(
                flipHorizontal ^ target.flipHorizontal,
                flipVertical ^ target.flipVertical,
                rotate != target.rotate);
    }

    public boolean isNormal() {
        return !flipHorizontal && !flipVertical && !rotate;
    }
}
