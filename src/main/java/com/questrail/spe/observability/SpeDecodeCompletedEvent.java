package com.questrail.spe.observability;

import com.questrail.spe.api.FileVersion;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Record summarising a completed decode.
 */
public record SpeDecodeCompletedEvent(
    Instant timestamp,
    FileVersion version,
    int frameCount,
    List<String> regions,
    List<String> trackingFields,
    Duration elapsed
) {
    public SpeDecodeCompletedEvent {
        regions = List.copyOf(regions);
        trackingFields = List.copyOf(trackingFields);
    }
}
