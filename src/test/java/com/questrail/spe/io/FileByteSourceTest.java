package com.questrail.spe.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class FileByteSourceTest
{
    @TempDir
    Path tempDir;

    @Test
    void readsAtPositionsAndStopsAtEnd() throws IOException
    {
        Path file = Files.write(tempDir.resolve("bytes.bin"), new byte[] {1, 2, 3, 4, 5});

        try (ByteSource source = ByteSource.open(file)) {
            assertEquals(5, source.size());

            ByteBuffer middle = ByteBuffer.allocate(2);
            assertEquals(2, source.readFully(2, middle));
            assertArrayEquals(new byte[] {3, 4}, middle.array());

            ByteBuffer tail = ByteBuffer.allocate(4);
            assertEquals(1, source.readFully(4, tail));
        }
    }

    @Test
    void reopenGivesIndependentHandle() throws IOException
    {
        Path file = Files.write(tempDir.resolve("bytes.bin"), new byte[] {9, 8, 7});

        try (ByteSource source = ByteSource.open(file)) {
            try (ByteSource other = source.reopen()) {
                ByteBuffer buffer = ByteBuffer.allocate(1);
                other.readFully(0, buffer);
                assertEquals(9, buffer.get(0));
            }
            assertEquals(3, source.size());
        }
    }

    @Test
    void inMemorySourceBehavesLikeFile() throws IOException
    {
        ByteSource source = ByteSource.wrap(new byte[] {1, 2, 3});

        ByteBuffer buffer = ByteBuffer.allocate(5);
        assertEquals(3, source.readFully(0, buffer));
        assertEquals(-1, source.read(3, ByteBuffer.allocate(1)));
    }
}
