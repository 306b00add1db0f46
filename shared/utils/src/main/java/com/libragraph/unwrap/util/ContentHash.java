package com.libragraph.unwrap.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents a SHA-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key.
 */
public record ContentHash(byte[] bytes) {
    public static final int HASH_LENGTH = 32; // 256 bits
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Content hash must be 32 bytes (SHA-256), got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Hashes the given content.
     */
    public static ContentHash of(byte[] content) {
        return new ContentHash(DigestUtils.sha256(content));
    }

    /**
     * Returns lowercase hex representation (64 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
