package com.libragraph.unwrap.formats.api;

import java.util.Arrays;

/**
 * Magic-byte criteria for detecting a format from a payload header.
 *
 * @param label        format label, for logging
 * @param magicBytes   magic bytes to match
 * @param magicOffset  offset in header where magic bytes start (0 for most formats, 257 for TAR)
 * @param priority     higher priority wins when several criteria match
 */
public record DetectionCriteria(
        String label,
        byte[] magicBytes,
        int magicOffset,
        int priority
) {
    public DetectionCriteria {
        if (magicBytes == null || magicBytes.length == 0) {
            throw new IllegalArgumentException("Magic bytes are required for " + label);
        }
        if (magicOffset < 0) {
            throw new IllegalArgumentException("Negative magic offset: " + magicOffset);
        }
        magicBytes = Arrays.copyOf(magicBytes, magicBytes.length);
    }

    /**
     * Checks whether the header carries the magic bytes at the configured offset.
     */
    public boolean matches(byte[] header) {
        if (header == null) {
            return false;
        }
        int endOffset = magicOffset + magicBytes.length;
        if (header.length < endOffset) {
            return false;
        }
        for (int i = 0; i < magicBytes.length; i++) {
            if (header[magicOffset + i] != magicBytes[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Bytes of header needed to evaluate this criteria.
     */
    public int headerLength() {
        return magicOffset + magicBytes.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DetectionCriteria other)) return false;
        return magicOffset == other.magicOffset
                && priority == other.priority
                && label.equals(other.label)
                && Arrays.equals(magicBytes, other.magicBytes);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * label.hashCode() + Arrays.hashCode(magicBytes)) + magicOffset;
    }

    @Override
    public String toString() {
        return "DetectionCriteria[" + label + "@" + magicOffset + ", priority=" + priority + "]";
    }
}
