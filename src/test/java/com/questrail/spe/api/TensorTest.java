package com.questrail.spe.api;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.junit.jupiter.api.Assertions.*;

final class TensorTest
{
    private static byte[] int16(short... values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * 2).order(ByteOrder.LITTLE_ENDIAN);
        for (short value : values) {
            buffer.putShort(value);
        }
        return buffer.array();
    }

    @Test
    void indexesRowMajor()
    {
        Tensor tensor = Tensor.of(NumericType.INT16, new int[] {2, 2, 3}, int16(
                (short) 0, (short) 1, (short) 2, (short) 3, (short) 4, (short) 5,
                (short) 6, (short) 7, (short) 8, (short) 9, (short) 10, (short) -11));

        assertEquals(3, tensor.rank());
        assertEquals(12, tensor.size());
        assertEquals(5, tensor.getLong(0, 1, 2));
        assertEquals(6, tensor.getLong(1, 0, 0));
        assertEquals(-11.0, tensor.getDouble(1, 1, 2));
    }

    @Test
    void isImmutable()
    {
        byte[] data = int16((short) 1, (short) 2);
        Tensor tensor = Tensor.of(NumericType.INT16, new int[] {2}, data);

        data[0] = 99;
        tensor.toByteArray()[0] = 99;
        tensor.shape()[0] = 7;

        assertEquals(1, tensor.getLong(0));
        assertEquals(2, tensor.extent(0));
    }

    @Test
    void rejectsSizeMismatch()
    {
        assertThrows(IllegalArgumentException.class, () -> Tensor.of(NumericType.UINT16, new int[] {2, 2}, new byte[6]));
    }

    @Test
    void rejectsOutOfRangeIndex()
    {
        Tensor tensor = Tensor.of(NumericType.UINT8, new int[] {2, 2}, new byte[4]);

        assertThrows(IndexOutOfBoundsException.class, () -> tensor.getLong(2, 0));
        assertThrows(IllegalArgumentException.class, () -> tensor.getLong(0));
    }

    @Test
    void unsignedValuesWiden()
    {
        Tensor tensor = Tensor.of(NumericType.UINT16, new int[] {1}, int16((short) 0xFFFF));

        assertEquals(65535.0, tensor.toDoubleArray()[0]);
    }
}
