package com.questrail.spe.internal.document;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The {@code Calibrations} section: calibration mappings in document order and
 * the {@code SensorInformation} attributes, if present.
 */
public record RawCalibrations(List<RawCalibration> mappings, Optional<Map<String, String>> sensorInformation)
{
    public RawCalibrations {
        mappings = List.copyOf(mappings);
        Objects.requireNonNull(sensorInformation, "sensorInformation");
    }
}
