package com.libragraph.unwrap.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Buffer that starts on the heap and moves its content to a {@link FileBuffer}
 * once a write would take it past the threshold. Used when the final size is
 * unknown or only estimated.
 */
class SpillingBuffer extends Buffer {

    private final long threshold;
    private Buffer delegate;

    SpillingBuffer(int initialCapacity, long threshold) {
        this.threshold = threshold;
        this.delegate = new RamBuffer(initialCapacity);
    }

    @Override
    public boolean inMemory() {
        return delegate.inMemory();
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        if (delegate.inMemory() && delegate.position() + src.remaining() >= threshold) {
            spill();
        }
        return delegate.write(src);
    }

    private void spill() throws IOException {
        FileBuffer file = new FileBuffer();
        try {
            long pos = delegate.position();
            ByteBuffer content = ByteBuffer.wrap(delegate.toByteArray());
            while (content.hasRemaining()) {
                file.write(content);
            }
            file.position(pos);
        } catch (IOException | RuntimeException e) {
            file.close();
            throw e;
        }
        delegate = file;
    }

    @Override
    public long size() {
        return delegate.size();
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return delegate.read(dst);
    }

    @Override
    public SeekableByteChannel truncate(long size) throws IOException {
        delegate.truncate(size);
        return this;
    }

    @Override
    public long position() throws IOException {
        return delegate.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        delegate.position(newPosition);
        return this;
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    @Override
    public void close() throws IOException {
        delegate.close();
    }

    @Override
    public byte[] toByteArray() {
        return delegate.toByteArray();
    }
}
