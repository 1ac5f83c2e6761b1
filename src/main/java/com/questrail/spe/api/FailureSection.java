package com.questrail.spe.api;

/**
 * The part of an SPE file in which a structural error was detected.
 */
public enum FailureSection
{
    HEADER,
    ROI_LAYOUT,
    FRAME_DATA,
    METADATA_DOCUMENT
}
