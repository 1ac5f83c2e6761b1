package com.questrail.spe.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Dataset
 * -----------------------------------------------------------------------------
 * The decoded contents of one SPE file: one {@link DataArray} per region of
 * interest, keyed by region name in declaration order, plus a single shared
 * {@link Metadata} instance.
 *
 * <p>A dataset is assembled once per decode and is immutable. Metadata is
 * attached here exactly once rather than duplicated on every array.</p>
 */
public final class Dataset
{
    private final Map<String, DataArray> arrays;
    private final Metadata metadata;

    public Dataset(List<DataArray> arrays, Metadata metadata) {
        Objects.requireNonNull(arrays, "arrays");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        Map<String, DataArray> byName = new LinkedHashMap<>();
        for (DataArray array : arrays) {
            if (byName.put(array.name(), array) != null) {
                throw new IllegalArgumentException("Duplicate array name: " + array.name());
            }
        }
        this.arrays = Collections.unmodifiableMap(byName);
    }

    public Metadata metadata() {
        return metadata;
    }

    public Set<String> names() {
        return arrays.keySet();
    }

    /**
     * Returns the arrays in region declaration order.
     */
    public List<DataArray> arrays() {
        return Collections.unmodifiableList(new ArrayList<>(arrays.values()));
    }

    /**
     * Returns the array for the named region.
     *
     * @throws NoSuchElementException if no region has that name
     */
    public DataArray get(String name) {
        DataArray array = arrays.get(name);
        if (array == null) {
            throw new NoSuchElementException("No region named '" + name + "', available: " + arrays.keySet());
        }
        return array;
    }

    public int frameCount() {
        return metadata.frameCount();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset that)) return false;
        return arrays.equals(that.arrays) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(arrays, metadata);
    }

    @Override
    public String toString() {
        return "Dataset[" + metadata.version() + ", frames=" + metadata.frameCount() + ", arrays=" + arrays.keySet() + ']';
    }
}
