package com.libragraph.unwrap.formats.registry;

import com.libragraph.unwrap.types.ArchiveKind;
import com.libragraph.unwrap.types.CompressionKind;
import com.libragraph.unwrap.types.FormatKind;

/**
 * Outcome of sniffing one payload header. Both axes are evaluated independently.
 *
 * @param archive      container kind, {@link ArchiveKind#UNKNOWN} if none
 * @param compression  compression kind, {@link CompressionKind#NONE} if none
 */
public record SniffResult(ArchiveKind archive, CompressionKind compression) {

    public static final SniffResult LEAF = new SniffResult(ArchiveKind.UNKNOWN, CompressionKind.NONE);

    /**
     * True when nothing further can be unwrapped from the payload.
     */
    public boolean isLeaf() {
        return !archive.isContainer() && !compression.isCompressed();
    }

    /**
     * Label for this header alone: compression wins, then archive.
     */
    public FormatKind formatKind() {
        if (compression.isCompressed()) {
            return FormatKind.of(compression);
        }
        return FormatKind.of(archive);
    }
}
