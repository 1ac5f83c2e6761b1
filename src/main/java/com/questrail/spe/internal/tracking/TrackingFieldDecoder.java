package com.questrail.spe.internal.tracking;

import com.questrail.spe.api.FrameTrackFieldSpec;
import com.questrail.spe.api.TrackingLayout;
import com.questrail.spe.internal.frame.Frame;

import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TrackingFieldDecoder
 * -----------------------------------------------------------------------------
 * Decodes the per-frame tracking block into one named scalar per field.
 *
 * <p>For each {@link FrameTrackFieldSpec} the bytes
 * {@code [offset, offset + size)} of the tracking block are read as the
 * field's element kind and divided by its resolution. When the file has no
 * tracking layout the decoder is a no-op and yields nothing.</p>
 */
public final class TrackingFieldDecoder
{
    private final List<FrameTrackFieldSpec> fields;

    public TrackingFieldDecoder(Optional<TrackingLayout> layout) {
        Objects.requireNonNull(layout, "layout");
        this.fields = layout.map(TrackingLayout::fields).orElse(List.of());
    }

    /**
     * Returns the names of the fields this decoder produces, in layout order.
     */
    public List<String> fieldNames() {
        return fields.stream().map(FrameTrackFieldSpec::name).toList();
    }

    /**
     * Decodes the tracking block of {@code frame}.
     *
     * @return values by field name; empty when there is no layout
     * @throws IllegalArgumentException if a layout exists but the frame has no tracking block
     */
    public Map<String, Double> decode(Frame frame) {
        Objects.requireNonNull(frame, "frame");
        if (fields.isEmpty()) {
            return Map.of();
        }
        final ByteBuffer block = frame.trackingBlock().orElseThrow(() ->
                new IllegalArgumentException("Frame " + frame.index() + " carries no tracking block"));

        final Map<String, Double> values = new LinkedHashMap<>();
        for (FrameTrackFieldSpec field : fields) {
            final double raw = field.type().readDouble(block, field.offset());
            values.put(field.name(), raw / field.resolution());
        }
        return values;
    }

    /**
     * Returns {@code frame} with its decoded tracking values attached.
     */
    public Frame annotate(Frame frame) {
        return fields.isEmpty() ? frame : frame.withTrackingValues(decode(frame));
    }
}
