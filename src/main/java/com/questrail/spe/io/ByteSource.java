package com.questrail.spe.io;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;

/**
 * ByteSource
 * -----------------------------------------------------------------------------
 * Seekable, read-only view of the bytes of an SPE file.
 *
 * <p>All reads are positional; a source keeps no cursor, so the decoder can
 * jump between the header, the frame region and the trailing metadata
 * document without any shared position state.</p>
 *
 * <p>Implementations hold an underlying handle that must be released with
 * {@link #close()} on every exit path.</p>
 */
public interface ByteSource extends Closeable
{
    /**
     * Returns the total number of bytes available.
     */
    long size() throws IOException;

    /**
     * Reads bytes starting at {@code position} into {@code destination}.
     *
     * @return the number of bytes read, possibly zero, or {@code -1} at end of data
     */
    int read(long position, ByteBuffer destination) throws IOException;

    /**
     * Opens an independent handle on the same bytes, for use by another thread.
     */
    ByteSource reopen() throws IOException;

    /**
     * Reads until {@code destination} is full or the data ends.
     *
     * @return the number of bytes actually read
     */
    default int readFully(long position, ByteBuffer destination) throws IOException {
        int total = 0;
        while (destination.hasRemaining()) {
            int n = read(position + total, destination);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    static ByteSource open(Path file) throws IOException {
        return FileByteSource.open(file);
    }

    static ByteSource wrap(byte[] bytes) {
        return new ByteArraySource(bytes);
    }
}
