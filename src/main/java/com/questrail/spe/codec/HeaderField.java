package com.questrail.spe.codec;

/**
 * Named fields of the fixed 4100-byte SPE header.
 *
 * <p>Offsets and encodings are not part of this enum; they live in the
 * version-specific {@link HeaderLayout} tables.</p>
 */
public enum HeaderField
{
    SENSOR_WIDTH,
    EXPOSURE,
    SENSOR_HEIGHT,
    DATE,
    DETECTOR_TEMPERATURE,
    STORED_WIDTH,
    DATA_TYPE,
    EXPERIMENT_TIME_LOCAL,
    EXPERIMENT_TIME_UTC,
    GEOMETRIC,
    STORED_HEIGHT,
    LNOSCAN,
    XML_OFFSET,
    FRAME_COUNT,
    ROI_COUNT,
    ROI_TABLE,
    HEADER_VERSION,
    WINVIEW_ID,
    CALIBRATION_VALID,
    CALIBRATION_POLYNOMIAL_ORDER,
    CALIBRATION_COEFFICIENTS,
    CALIBRATION_LABEL,
    LAST_VALUE
}
