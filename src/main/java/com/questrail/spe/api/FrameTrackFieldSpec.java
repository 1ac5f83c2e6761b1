package com.questrail.spe.api;

import java.util.Objects;

/**
 * Placement and encoding of one per-frame tracking value inside the tracking
 * block that trails every frame.
 *
 * @param name       coordinate name, e.g. {@code exposure_start}
 * @param offset     byte offset within the tracking block
 * @param size       byte size of the stored value
 * @param type       stored element kind
 * @param resolution divisor applied to the stored value (ticks per unit)
 */
public record FrameTrackFieldSpec(
        String name,
        int offset,
        int size,
        NumericType type,
        double resolution
) {
    public FrameTrackFieldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (size != type.width()) {
            throw new IllegalArgumentException("Field " + name + " size " + size + " does not match " + type);
        }
    }
}
