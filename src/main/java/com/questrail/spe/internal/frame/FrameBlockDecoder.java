package com.questrail.spe.internal.frame;

import com.questrail.spe.api.FailureSection;
import com.questrail.spe.api.ResolvedRoi;
import com.questrail.spe.api.SpeFormatException;
import com.questrail.spe.internal.layout.FrameLayout;
import com.questrail.spe.io.ByteSource;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * FrameBlockDecoder
 * =============================================================================
 * Reads frame blocks from the frame region that follows the header.
 *
 * <h2>Addressing</h2>
 * Frame {@code i} occupies {@code [HEADER_SIZE + i * stride, HEADER_SIZE + (i + 1) * stride)}.
 * Every frame is therefore an independent unit and may be read in any order,
 * or from several handles at once, against the same immutable {@link FrameLayout}.
 *
 * <h2>Truncation</h2>
 * The stride is known exactly, so a frame that cannot be read in full signals
 * corruption. A short read is always a {@link SpeFormatException} tagged
 * {@link FailureSection#FRAME_DATA}; frames are never silently skipped.
 */
public final class FrameBlockDecoder
{
    private final FrameLayout layout;
    private final int frameCount;

    public FrameBlockDecoder(FrameLayout layout, int frameCount) {
        this.layout = Objects.requireNonNull(layout, "layout");
        if (frameCount < 0) {
            throw new IllegalArgumentException("frameCount must not be negative");
        }
        this.frameCount = frameCount;
    }

    public int frameCount() {
        return frameCount;
    }

    /**
     * Checks up front that the source holds all declared frames, and that they
     * end before the metadata document when there is one.
     */
    public void verifyExtent(ByteSource source, OptionalLong documentOffset) throws IOException {
        final long end = layout.dataEnd(frameCount);
        final long size = source.size();
        if (end > size) {
            throw new SpeFormatException(FailureSection.FRAME_DATA, String.format(
                    "%d frames of %d bytes need %d bytes, file holds %d", frameCount, layout.frameStride(), end, size));
        }
        if (documentOffset.isPresent() && end > documentOffset.getAsLong()) {
            throw new SpeFormatException(FailureSection.FRAME_DATA, String.format(
                    "Frame data ends at %d, past the metadata document at %d", end, documentOffset.getAsLong()));
        }
    }

    /**
     * Reads and slices frame {@code index}.
     */
    public Frame decode(ByteSource source, int index) throws IOException {
        if (index < 0 || index >= frameCount) {
            throw new IndexOutOfBoundsException("frame " + index + " of " + frameCount);
        }
        if (layout.frameStride() > Integer.MAX_VALUE) {
            throw new SpeFormatException(FailureSection.FRAME_DATA,
                    "Frame stride " + layout.frameStride() + " exceeds the largest readable block");
        }

        final int stride = (int) layout.frameStride();
        final ByteBuffer block = ByteBuffer.allocate(stride).order(ByteOrder.LITTLE_ENDIAN);
        final long offset = layout.frameOffset(index);
        final int read = source.readFully(offset, block);
        if (read < stride) {
            throw new SpeFormatException(FailureSection.FRAME_DATA, String.format(
                    "Frame %d truncated: read %d of %d bytes at offset %d", index, read, stride, offset));
        }

        final List<ByteBuffer> roiBlocks = new ArrayList<>(layout.rois().size());
        for (ResolvedRoi roi : layout.rois()) {
            roiBlocks.add(slice(block, (int) roi.byteOffset(), (int) roi.byteSize()));
        }

        final Optional<ByteBuffer> tracking = layout.trackingBlockSize() > 0
                ? Optional.of(slice(block, (int) layout.trackingBlockOffset(), layout.trackingBlockSize()))
                : Optional.empty();

        return new Frame(index, roiBlocks, tracking, Map.of());
    }

    /**
     * Reads frames {@code [from, to)} in order.
     */
    public List<Frame> decodeRange(ByteSource source, int from, int to) throws IOException {
        if (from < 0 || to > frameCount || from > to) {
            throw new IndexOutOfBoundsException("range " + from + ".." + to + " of " + frameCount);
        }
        final List<Frame> frames = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            frames.add(decode(source, i));
        }
        return frames;
    }

    private static ByteBuffer slice(ByteBuffer block, int offset, int length) {
        return block.slice(offset, length).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
    }
}
