package com.questrail.spe.io;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * In-memory {@link ByteSource}. Closing it is a no-op.
 */
final class ByteArraySource implements ByteSource
{
    private final byte[] bytes;

    ByteArraySource(byte[] bytes) {
        this.bytes = Objects.requireNonNull(bytes, "bytes");
    }

    @Override
    public long size() {
        return bytes.length;
    }

    @Override
    public int read(long position, ByteBuffer destination) {
        if (position < 0) {
            throw new IllegalArgumentException("Negative position: " + position);
        }
        if (position >= bytes.length) {
            return -1;
        }
        int n = (int) Math.min(destination.remaining(), bytes.length - position);
        destination.put(bytes, (int) position, n);
        return n;
    }

    @Override
    public ByteSource reopen() {
        return new ByteArraySource(bytes);
    }

    @Override
    public void close() {
    }
}
