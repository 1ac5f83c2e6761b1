package com.questrail.spe.observability;

import com.questrail.spe.api.FileVersion;
import com.questrail.spe.api.NumericType;

import java.time.Instant;

/**
 * Record summarising a decoded SPE header.
 */
public record SpeHeaderEvent(
    Instant timestamp,
    FileVersion version,
    int frameCount,
    int roiCount,
    NumericType dataType
) {
}
