package com.questrail.spe.observability;

import java.time.Instant;

/**
 * Record representing an aborted decode.
 */
public record SpeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
