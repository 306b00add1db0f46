package com.libragraph.unwrap.util.buffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Buffer implementation backed by a temporary file.
 * Holds payloads of 4 MB and more.
 *
 * <p>The temp file is created on construction and deleted on {@link #close()}.
 */
public class FileBuffer extends Buffer {

    private final Path path;
    private final FileChannel channel;
    private boolean open = true;

    public FileBuffer() throws IOException {
        this.path = Files.createTempFile("unwrap-buf-", ".tmp");
        this.channel = FileChannel.open(path,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.DELETE_ON_CLOSE);
    }

    Path path() {
        return path;
    }

    @Override
    public boolean inMemory() {
        return false;
    }

    @Override
    public long size() {
        try {
            return channel.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to get file size", e);
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return channel.read(dst);
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        return channel.write(src);
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        channel.truncate(newSize);
        if (channel.position() > newSize) {
            channel.position(newSize);
        }
        return this;
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        channel.position(newPosition);
        return this;
    }

    @Override
    public boolean isOpen() {
        return open && channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (open) {
            open = false;
            channel.close();
            Files.deleteIfExists(path);
        }
    }
}
