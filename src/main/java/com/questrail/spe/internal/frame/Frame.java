package com.questrail.spe.internal.frame;

import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Frame
 * -----------------------------------------------------------------------------
 * One decoded frame block: a raw little-endian buffer per region in
 * declaration order, the raw tracking block if the file has one, and the
 * tracking values decoded from it.
 *
 * <p>Buffers are read-only views and are row-major (y outer, x inner).</p>
 *
 * @param index          0-based frame index
 * @param roiBlocks      one buffer per region, in declaration order
 * @param trackingBlock  raw tracking block, if the layout has one
 * @param trackingValues decoded tracking values by field name (empty until decoded)
 */
public record Frame(
        int index,
        List<ByteBuffer> roiBlocks,
        Optional<ByteBuffer> trackingBlock,
        Map<String, Double> trackingValues
) {
    public Frame {
        roiBlocks = List.copyOf(roiBlocks);
        Objects.requireNonNull(trackingBlock, "trackingBlock");
        trackingValues = Collections.unmodifiableMap(new LinkedHashMap<>(trackingValues));
    }

    /**
     * Returns a copy of this frame carrying the given decoded tracking values.
     */
    public Frame withTrackingValues(Map<String, Double> values) {
        return new Frame(index, roiBlocks, trackingBlock, values);
    }
}
