package com.questrail.spe.api;

import java.nio.ByteBuffer;
import java.util.Locale;
import java.util.Optional;

/**
 * NumericType
 * -----------------------------------------------------------------------------
 * Element kinds that appear in SPE files, either as pixel data or as per-frame
 * tracking fields.
 *
 * <p>All reads are absolute and assume the supplied buffer is little-endian.
 * SPE stores every multi-byte value in little-endian order regardless of file
 * version.</p>
 *
 * <h2>Naming schemes</h2>
 * <ul>
 *   <li>Legacy header {@code datatype} code (see {@link #fromDataTypeCode(int)})</li>
 *   <li>Modern {@code pixelFormat} attribute (see {@link #fromPixelFormat(String)})</li>
 *   <li>Modern tracking field {@code type} attribute (see {@link #fromTrackingType(String)})</li>
 * </ul>
 */
public enum NumericType
{
    UINT8(1, false, false),
    INT16(2, true, false),
    UINT16(2, false, false),
    INT32(4, true, false),
    UINT32(4, false, false),
    INT64(8, true, false),
    UINT64(8, false, false),
    FLOAT32(4, true, true),
    FLOAT64(8, true, true);

    private final int width;
    private final boolean signed;
    private final boolean floatingPoint;

    NumericType(int width, boolean signed, boolean floatingPoint) {
        this.width = width;
        this.signed = signed;
        this.floatingPoint = floatingPoint;
    }

    /**
     * Returns the element width in bytes.
     */
    public int width() {
        return width;
    }

    public boolean isSigned() {
        return signed;
    }

    public boolean isFloatingPoint() {
        return floatingPoint;
    }

    /**
     * Reads one element at the absolute byte index and widens it to {@code double}.
     */
    public double readDouble(ByteBuffer buffer, int index) {
        return switch (this) {
            case UINT8 -> buffer.get(index) & 0xFF;
            case INT16 -> buffer.getShort(index);
            case UINT16 -> buffer.getShort(index) & 0xFFFF;
            case INT32 -> buffer.getInt(index);
            case UINT32 -> buffer.getInt(index) & 0xFFFFFFFFL;
            case INT64 -> (double) buffer.getLong(index);
            case UINT64 -> unsignedToDouble(buffer.getLong(index));
            case FLOAT32 -> buffer.getFloat(index);
            case FLOAT64 -> buffer.getDouble(index);
        };
    }

    /**
     * Reads one element at the absolute byte index as an integral value.
     *
     * <p>Floating point elements are truncated toward zero. {@code UINT64}
     * values above {@link Long#MAX_VALUE} wrap, as they do in Java.</p>
     */
    public long readLong(ByteBuffer buffer, int index) {
        return switch (this) {
            case UINT8 -> buffer.get(index) & 0xFF;
            case INT16 -> buffer.getShort(index);
            case UINT16 -> buffer.getShort(index) & 0xFFFF;
            case INT32 -> buffer.getInt(index);
            case UINT32 -> buffer.getInt(index) & 0xFFFFFFFFL;
            case INT64, UINT64 -> buffer.getLong(index);
            case FLOAT32 -> (long) buffer.getFloat(index);
            case FLOAT64 -> (long) buffer.getDouble(index);
        };
    }

    /**
     * Returns the legacy header {@code datatype} code for this element kind,
     * or {@code -1} when the legacy format cannot express it.
     */
    public int dataTypeCode() {
        return switch (this) {
            case FLOAT32 -> 0;
            case INT32 -> 1;
            case INT16 -> 2;
            case UINT16 -> 3;
            case FLOAT64 -> 5;
            case UINT8 -> 6;
            case UINT32 -> 8;
            case INT64, UINT64 -> -1;
        };
    }

    /**
     * Maps a header {@code datatype} code to an element kind.
     */
    public static Optional<NumericType> fromDataTypeCode(int code) {
        for (NumericType type : values()) {
            if (type.dataTypeCode() == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a modern {@code pixelFormat} name such as {@code MonochromeUnsigned16}.
     */
    public static Optional<NumericType> fromPixelFormat(String pixelFormat) {
        if (pixelFormat == null) {
            return Optional.empty();
        }
        return switch (pixelFormat.trim().toLowerCase(Locale.ROOT)) {
            case "monochromeunsigned8" -> Optional.of(UINT8);
            case "monochromesigned16" -> Optional.of(INT16);
            case "monochromeunsigned16" -> Optional.of(UINT16);
            case "monochromesigned32" -> Optional.of(INT32);
            case "monochromeunsigned32" -> Optional.of(UINT32);
            case "monochromefloating32" -> Optional.of(FLOAT32);
            case "monochromefloating64" -> Optional.of(FLOAT64);
            default -> Optional.empty();
        };
    }

    /**
     * Maps a modern tracking field {@code type} attribute such as {@code Int64}
     * or {@code Double}.
     */
    public static Optional<NumericType> fromTrackingType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "byte", "uint8" -> Optional.of(UINT8);
            case "int16" -> Optional.of(INT16);
            case "uint16" -> Optional.of(UINT16);
            case "int32" -> Optional.of(INT32);
            case "uint32" -> Optional.of(UINT32);
            case "int64" -> Optional.of(INT64);
            case "uint64" -> Optional.of(UINT64);
            case "single", "float" -> Optional.of(FLOAT32);
            case "double" -> Optional.of(FLOAT64);
            default -> Optional.empty();
        };
    }

    private static double unsignedToDouble(long value) {
        if (value >= 0) {
            return value;
        }
        return (double) (value >>> 1) * 2.0 + (value & 1L);
    }
}
