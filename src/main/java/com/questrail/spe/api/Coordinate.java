package com.questrail.spe.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * A named coordinate array laid along one dimension of a {@link DataArray}.
 */
public final class Coordinate
{
    private final String name;
    private final String dimension;
    private final double[] values;

    public Coordinate(String name, String dimension, double[] values) {
        this.name = Objects.requireNonNull(name, "name");
        this.dimension = Objects.requireNonNull(dimension, "dimension");
        this.values = Objects.requireNonNull(values, "values").clone();
    }

    public String name() {
        return name;
    }

    /**
     * Returns the dimension this coordinate is aligned with.
     */
    public String dimension() {
        return dimension;
    }

    public int length() {
        return values.length;
    }

    public double value(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Coordinate that)) return false;
        return name.equals(that.name) && dimension.equals(that.dimension) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(name, dimension) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Coordinate[" + name + " along " + dimension + ", length=" + values.length + ']';
    }
}
