package com.questrail.spe.internal.layout;

import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.Metadata;
import com.questrail.spe.api.NumericType;
import com.questrail.spe.api.ResolvedRoi;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.codec.HeaderLayout;

import java.util.List;
import java.util.Objects;

/**
 * Byte layout shared by every frame block of a file.
 *
 * <p>Frame {@code i} starts at {@code HEADER_SIZE + i * frameStride}, so any
 * frame can be located without reading its predecessors.</p>
 *
 * @param rois              regions in storage order
 * @param trackingBlockSize bytes of the trailing tracking block, 0 if none
 * @param frameStride       bytes per frame block
 * @param pixelType         element kind of region data
 */
public record FrameLayout(List<ResolvedRoi> rois, int trackingBlockSize, long frameStride, NumericType pixelType)
{
    public FrameLayout {
        rois = List.copyOf(rois);
        Objects.requireNonNull(pixelType, "pixelType");
        long sum = trackingBlockSize;
        for (ResolvedRoi roi : rois) {
            sum += roi.byteSize();
        }
        if (sum != frameStride) {
            throw new IllegalArgumentException("ROI sizes plus tracking block (" + sum
                    + ") differ from frame stride " + frameStride);
        }
    }

    /**
     * Rebuilds the layout recorded in unified metadata.
     */
    public static FrameLayout of(Metadata metadata) {
        return new FrameLayout(metadata.rois(), metadata.trackingBlockSize(),
                metadata.frameStride(), metadata.pixelType());
    }

    /**
     * Absolute file offset of frame {@code index}.
     *
     * @throws SpeFormatException if the offset does not fit in a {@code long}
     */
    public long frameOffset(int index) {
        try {
            return Math.addExact(HeaderLayout.HEADER_SIZE, Math.multiplyExact((long) index, frameStride));
        }
        catch (ArithmeticException e) {
            throw new SpeFormatException(FailureSection.FRAME_DATA, String.format(
                    "Frame %d at stride %d lies beyond any addressable file offset", index, frameStride), e);
        }
    }

    /**
     * Offset of the tracking block within a frame block.
     */
    public long trackingBlockOffset() {
        return frameStride - trackingBlockSize;
    }

    /**
     * File offset just past the last of {@code frameCount} frames.
     */
    public long dataEnd(int frameCount) {
        return frameOffset(frameCount);
    }
}
