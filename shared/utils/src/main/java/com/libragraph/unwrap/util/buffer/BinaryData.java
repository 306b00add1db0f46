package com.libragraph.unwrap.util.buffer;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only binary data backed by RAM or a disk file.
 *
 * Implements SeekableByteChannel for direct channel-based access (zip central
 * directory reads go straight through it). Provides convenience methods for
 * stream-based access and format sniffing.
 *
 * Design principles:
 * - Size is always available
 * - Stream access uses standard JDK wrappers (Channels.newInputStream)
 * - Streams share the channel position: one reader at a time
 */
public abstract class BinaryData implements SeekableByteChannel {

    /** Largest payload {@link #toByteArray()} will materialize. */
    public static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    /**
     * Wraps an existing SeekableByteChannel as BinaryData.
     */
    public static BinaryData wrap(SeekableByteChannel channel) {
        return new WrappedBinaryData(channel);
    }

    /**
     * Wraps a byte array without copying it.
     */
    public static BinaryData of(byte[] bytes) {
        return new RamBuffer(bytes);
    }

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Opens an InputStream positioned at the given offset.
     * Closing the stream leaves this channel open.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return new FilterInputStream(Channels.newInputStream(this)) {
                @Override
                public void close() {
                    // channel lifetime is owned by the BinaryData
                }
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create input stream at position " + pos, e);
        }
    }

    /**
     * Reads the first N bytes as a header (for format sniffing).
     * Does not advance the buffer position.
     *
     * Hard limit: min(maxBytes, 64KB) to prevent unbounded reads.
     *
     * @param maxBytes maximum bytes to read
     * @return header bytes (may be shorter than maxBytes if the data is smaller)
     */
    public byte[] readHeader(int maxBytes) {
        int limit = Math.min(maxBytes, 64 * 1024);
        int toRead = (int) Math.min(limit, size());

        try {
            long originalPos = position();
            position(0);

            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            while (buffer.hasRemaining() && read(buffer) > 0) {
                // short reads from file channels
            }

            position(originalPos);

            byte[] header = new byte[buffer.position()];
            buffer.flip();
            buffer.get(header);
            return header;

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header", e);
        }
    }

    /**
     * Copies the whole payload into a new array.
     *
     * @throws IllegalStateException if the payload does not fit in an array
     */
    public byte[] toByteArray() {
        long size = size();
        if (size > MAX_ARRAY_SIZE) {
            throw new IllegalStateException("Payload too large for a byte array: " + size);
        }
        try (InputStream in = inputStream(0)) {
            return in.readNBytes((int) size);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read payload", e);
        }
    }
}
