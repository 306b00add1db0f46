package com.libragraph.unwrap.core.input;

import com.libragraph.unwrap.util.buffer.BinaryData;

/**
 * Input held in memory under a caller-chosen identity. The array is not copied.
 */
public record BufferSource(String identity, byte[] bytes) implements SourceInput {

    @Override
    public long rawSize() {
        return bytes.length;
    }

    @Override
    public BinaryData open() {
        return BinaryData.of(bytes);
    }
}
