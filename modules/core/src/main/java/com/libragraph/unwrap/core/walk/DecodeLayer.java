package com.libragraph.unwrap.core.walk;

import com.libragraph.unwrap.types.ArchiveKind;
import com.libragraph.unwrap.types.CompressionKind;
import com.libragraph.unwrap.types.FormatKind;

/**
 * One decode step applied while unwrapping a source: a decompression or a container expansion.
 *
 * @param format the format that was decoded
 * @param path   logical path of the payload the step was applied to
 */
public record DecodeLayer(FormatKind format, String path) {

    public static DecodeLayer of(CompressionKind compression, String path) {
        return new DecodeLayer(FormatKind.of(compression), path);
    }

    public static DecodeLayer of(ArchiveKind archive, String path) {
        return new DecodeLayer(FormatKind.of(archive), path);
    }

    public boolean isContainer() {
        return format == FormatKind.ZIP || format == FormatKind.TAR;
    }

    public String label() {
        return format.label();
    }
}
