package com.questrail.spe.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * {@link ByteSource} backed by a read-only {@link FileChannel}.
 */
public final class FileByteSource implements ByteSource
{
    private final Path file;
    private final FileChannel channel;

    private FileByteSource(Path file, FileChannel channel) {
        this.file = file;
        this.channel = channel;
    }

    public static FileByteSource open(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return new FileByteSource(file, FileChannel.open(file, StandardOpenOption.READ));
    }

    @Override
    public long size() throws IOException {
        return channel.size();
    }

    @Override
    public int read(long position, ByteBuffer destination) throws IOException {
        return channel.read(destination, position);
    }

    @Override
    public ByteSource reopen() throws IOException {
        return open(file);
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    @Override
    public String toString() {
        return "FileByteSource[" + file + ']';
    }
}
