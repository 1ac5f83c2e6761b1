package com.questrail.spe.internal.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One calibration mapping from the {@code Calibrations} section, unvalidated.
 *
 * @param kind       {@code WavelengthMapping} or {@code PolynomialMapping}
 * @param attributes mapping attributes
 * @param text       comma separated values or coefficients
 */
public record RawCalibration(String kind, Map<String, String> attributes, String text)
{
    public static final String WAVELENGTH_MAPPING = "WavelengthMapping";
    public static final String POLYNOMIAL_MAPPING = "PolynomialMapping";

    public RawCalibration {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        text = text == null ? "" : text;
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
