package com.questrail.spe.api;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * Tensor
 * -----------------------------------------------------------------------------
 * Immutable, row-major, little-endian n-dimensional array of a single
 * {@link NumericType}.
 *
 * <p>Pixel data is kept in its stored element kind rather than widened, so a
 * {@code uint16} region costs two bytes per pixel. Accessors widen on read.</p>
 *
 * Immutability is enforced via defensive copying.
 */
public final class Tensor
{
    private final NumericType type;
    private final int[] shape;
    private final int[] strides;
    private final byte[] data;

    private Tensor(NumericType type, int[] shape, byte[] data) {
        this.type = type;
        this.shape = shape;
        this.data = data;
        this.strides = new int[shape.length];
        int stride = 1;
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            strides[axis] = stride;
            stride *= shape[axis];
        }
    }

    /**
     * Creates a tensor over a copy of {@code data}.
     *
     * @throws IllegalArgumentException if {@code data} does not hold exactly
     *         {@code product(shape) * type.width()} bytes
     */
    public static Tensor of(NumericType type, int[] shape, byte[] data) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(data, "data");
        long elements = 1;
        for (int extent : shape) {
            if (extent < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
            elements *= extent;
        }
        if (elements * type.width() != data.length) {
            throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " of " + type
                    + " needs " + elements * type.width() + " bytes, got " + data.length);
        }
        return new Tensor(type, shape.clone(), data.clone());
    }

    public NumericType type() {
        return type;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    /**
     * Returns the extent of the given axis.
     */
    public int extent(int axis) {
        return shape[axis];
    }

    /**
     * Returns the total number of elements.
     */
    public int size() {
        return data.length / type.width();
    }

    public double getDouble(int... index) {
        return type.readDouble(buffer(), byteIndex(index));
    }

    public long getLong(int... index) {
        return type.readLong(buffer(), byteIndex(index));
    }

    /**
     * Returns every element widened to {@code double}, in row-major order.
     */
    public double[] toDoubleArray() {
        ByteBuffer buffer = buffer();
        double[] out = new double[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = type.readDouble(buffer, i * type.width());
        }
        return out;
    }

    /**
     * Returns a copy of the raw little-endian bytes.
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    private ByteBuffer buffer() {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    private int byteIndex(int[] index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("Expected " + shape.length + " indices, got " + index.length);
        }
        int flat = 0;
        for (int axis = 0; axis < index.length; axis++) {
            if (index[axis] < 0 || index[axis] >= shape[axis]) {
                throw new IndexOutOfBoundsException("index " + index[axis] + " on axis " + axis
                        + ", extent=" + shape[axis]);
            }
            flat += index[axis] * strides[axis];
        }
        return flat * type.width();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tensor that)) return false;
        return type == that.type && Arrays.equals(shape, that.shape) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type);
        result = 31 * result + Arrays.hashCode(shape);
        result = 31 * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public String toString() {
        return "Tensor[" + type + ", shape=" + Arrays.toString(shape) + ']';
    }
}
