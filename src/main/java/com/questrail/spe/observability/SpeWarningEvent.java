package com.questrail.spe.observability;

import com.questrail.spe.api.UnsupportedFeature;

import java.time.Instant;

/**
 * Record representing a recognised structure that the reader omitted.
 */
public record SpeWarningEvent(
    Instant timestamp,
    UnsupportedFeature feature
) {
}
