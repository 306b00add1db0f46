package com.libragraph.unwrap.core.extract;

import java.util.List;

/**
 * JSON document written next to the extracted files.
 */
public record ExtractionIndex(int version, List<LeafDescriptor> leaves) {

    public static final String FILE_NAME = "unwrap-index.json";
    public static final int CURRENT_VERSION = 1;

    public static ExtractionIndex of(List<LeafDescriptor> leaves) {
        return new ExtractionIndex(CURRENT_VERSION, List.copyOf(leaves));
    }
}
