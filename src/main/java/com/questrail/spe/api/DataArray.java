package com.questrail.spe.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DataArray
 * -----------------------------------------------------------------------------
 * All frames of one region of interest as a {@code (frame, y, x)} tensor,
 * together with its coordinate arrays.
 *
 * <p>Coordinates always include {@code frame}, {@code y} and {@code x}.
 * Calibration coordinates (e.g. {@code wavelength}) lie along {@code x} or
 * {@code y}; tracking series lie along {@code frame}.</p>
 */
public final class DataArray
{
    public static final String FRAME = "frame";
    public static final String Y = "y";
    public static final String X = "x";

    private static final List<String> DIMENSIONS = List.of(FRAME, Y, X);

    private final String name;
    private final ResolvedRoi roi;
    private final Tensor data;
    private final Map<String, Coordinate> coordinates;

    public DataArray(String name, ResolvedRoi roi, Tensor data, Map<String, Coordinate> coordinates) {
        this.name = Objects.requireNonNull(name, "name");
        this.roi = Objects.requireNonNull(roi, "roi");
        this.data = Objects.requireNonNull(data, "data");
        if (data.rank() != DIMENSIONS.size()) {
            throw new IllegalArgumentException("DataArray " + name + " requires a rank-3 tensor, got " + data);
        }
        this.coordinates = Collections.unmodifiableMap(new LinkedHashMap<>(coordinates));
        for (Coordinate coordinate : this.coordinates.values()) {
            int axis = DIMENSIONS.indexOf(coordinate.dimension());
            if (axis < 0) {
                throw new IllegalArgumentException("Unknown dimension " + coordinate.dimension()
                        + " for coordinate " + coordinate.name());
            }
            if (coordinate.length() != data.extent(axis)) {
                throw new IllegalStateException("Coordinate " + coordinate.name() + " has length "
                        + coordinate.length() + " but " + coordinate.dimension() + " has extent " + data.extent(axis));
            }
        }
    }

    public String name() {
        return name;
    }

    /**
     * Returns the region this array was decoded from.
     */
    public ResolvedRoi roi() {
        return roi;
    }

    public List<String> dimensions() {
        return DIMENSIONS;
    }

    public Tensor data() {
        return data;
    }

    public Map<String, Coordinate> coordinates() {
        return coordinates;
    }

    public Optional<Coordinate> coordinate(String coordinateName) {
        return Optional.ofNullable(coordinates.get(coordinateName));
    }

    public int frameCount() {
        return data.extent(0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataArray that)) return false;
        return name.equals(that.name) && roi.equals(that.roi) && data.equals(that.data)
                && coordinates.equals(that.coordinates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, roi, data, coordinates);
    }

    @Override
    public String toString() {
        return "DataArray[" + name + ", " + data + ", coordinates=" + coordinates.keySet() + ']';
    }
}
