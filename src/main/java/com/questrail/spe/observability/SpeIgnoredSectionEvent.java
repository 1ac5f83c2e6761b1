package com.questrail.spe.observability;

import java.time.Instant;

/**
 * Record naming a metadata document section that was skipped.
 */
public record SpeIgnoredSectionEvent(
    Instant timestamp,
    String section
) {
}
