package com.libragraph.unwrap.util.buffer;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;

/**
 * Writable buffer that extends BinaryData with write capabilities.
 *
 * Factory method allocates appropriate backend (RAM or file)
 * based on size thresholds.
 */
public abstract class Buffer extends BinaryData {

    /** Threshold above which payloads live in a temp file instead of RAM. */
    static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    /**
     * Allocates a buffer sized for the expected payload.
     * Chooses backend automatically based on size:
     * <ul>
     *   <li>&lt; 4 MB: starts in RAM and moves to a temp file if writes reach 4 MB</li>
     *   <li>&gt;= 4 MB: {@link FileBuffer} (temp-file backed {@link java.nio.channels.FileChannel})</li>
     * </ul>
     * A negative size means unknown and starts in RAM.
     */
    public static Buffer allocate(long size) {
        if (size < FILE_THRESHOLD) {
            return new SpillingBuffer((int) Math.max(size, 0), FILE_THRESHOLD);
        }
        try {
            return new FileBuffer();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate file-backed buffer", e);
        }
    }

    /**
     * True while the payload is held on the heap.
     */
    public abstract boolean inMemory();

    /**
     * Opens an OutputStream positioned at the given offset.
     * Closing the stream leaves this buffer open.
     *
     * @param pos starting position (0-based)
     * @return OutputStream positioned at offset
     */
    public OutputStream outputStream(long pos) {
        try {
            position(pos);
            return new FilterOutputStream(Channels.newOutputStream(this)) {
                @Override
                public void write(byte[] b, int off, int len) throws IOException {
                    out.write(b, off, len);
                }

                @Override
                public void close() {
                    // buffer lifetime is owned by the caller
                }
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create output stream at position " + pos, e);
        }
    }
}
