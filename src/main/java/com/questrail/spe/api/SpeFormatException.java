package com.questrail.spe.api;

import java.util.Objects;

/**
 * Indicates that an SPE file is structurally unreadable.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unrecognized version or sentinel values</li>
 *   <li>Invalid dimensions or ROI table entries</li>
 *   <li>ROI sizes that do not add up to the frame stride</li>
 *   <li>Frame data shorter than the declared frame count requires</li>
 *   <li>A malformed metadata document</li>
 * </ul>
 *
 * A structural error always aborts the whole decode; no partial dataset is
 * produced.
 */
public final class SpeFormatException extends RuntimeException
{
    private final FailureSection section;

    public SpeFormatException(FailureSection section, String message) {
        super(formatMessage(section, message));
        this.section = section;
    }

    public SpeFormatException(FailureSection section, String message, Throwable cause) {
        super(formatMessage(section, message), cause);
        this.section = section;
    }

    /**
     * Returns the file section in which the failure was detected.
     */
    public FailureSection section() {
        return section;
    }

    private static String formatMessage(FailureSection section, String message) {
        return Objects.requireNonNull(section, "section") + ": " + message;
    }
}
