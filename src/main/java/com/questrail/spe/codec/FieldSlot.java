package com.questrail.spe.codec;

import com.questrail.spe.api.NumericType;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Position and encoding of one header field.
 *
 * @param offset absolute byte offset within the header
 * @param type   element kind of each stored element
 * @param count  number of consecutive elements
 * @param text   {@code true} for NUL-padded ASCII text ({@code type} is then {@code UINT8})
 */
public record FieldSlot(int offset, NumericType type, int count, boolean text)
{
    public FieldSlot {
        Objects.requireNonNull(type, "type");
        if (offset < 0 || count < 1) {
            throw new IllegalArgumentException("Invalid slot offset=" + offset + " count=" + count);
        }
        if (text && type != NumericType.UINT8) {
            throw new IllegalArgumentException("Text slots are byte arrays");
        }
    }

    public static FieldSlot scalar(int offset, NumericType type) {
        return new FieldSlot(offset, type, 1, false);
    }

    public static FieldSlot array(int offset, NumericType type, int count) {
        return new FieldSlot(offset, type, count, false);
    }

    public static FieldSlot ascii(int offset, int length) {
        return new FieldSlot(offset, NumericType.UINT8, length, true);
    }

    /**
     * Returns the total byte size of the slot.
     */
    public int size() {
        return type.width() * count;
    }

    /**
     * Byte offset of element {@code index}.
     */
    public int elementOffset(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("element " + index + " of " + count);
        }
        return offset + index * type.width();
    }

    long readLong(ByteBuffer header) {
        return type.readLong(header, offset);
    }

    double readDouble(ByteBuffer header) {
        return type.readDouble(header, offset);
    }

    double readDouble(ByteBuffer header, int index) {
        return type.readDouble(header, elementOffset(index));
    }

    long readLong(ByteBuffer header, int index) {
        return type.readLong(header, elementOffset(index));
    }

    String readText(ByteBuffer header) {
        int length = 0;
        while (length < count && header.get(offset + length) != 0) {
            length++;
        }
        byte[] bytes = new byte[length];
        header.get(offset, bytes);
        return new String(bytes, StandardCharsets.US_ASCII).trim();
    }
}
