package com.questrail.spe.api;

import java.util.List;

/**
 * Layout of the per-frame tracking block.
 *
 * <p>{@code blockSize} covers every declared field, including fields whose
 * element kind is not supported and which are therefore absent from
 * {@code fields}.</p>
 */
public record TrackingLayout(List<FrameTrackFieldSpec> fields, int blockSize)
{
    public TrackingLayout {
        fields = List.copyOf(fields);
        for (FrameTrackFieldSpec field : fields) {
            if (field.offset() < 0 || field.offset() + field.size() > blockSize) {
                throw new IllegalArgumentException("Field " + field.name() + " lies outside the tracking block");
            }
        }
    }
}
