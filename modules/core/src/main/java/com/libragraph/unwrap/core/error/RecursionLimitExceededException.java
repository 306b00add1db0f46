package com.libragraph.unwrap.core.error;

import com.libragraph.unwrap.core.walk.DecodeLayer;

import java.util.List;

/**
 * Nesting went past the configured maximum depth.
 */
public class RecursionLimitExceededException extends DecodeException {

    private final int maxDepth;

    public RecursionLimitExceededException(int maxDepth, String source, String pathPrefix,
                                           List<DecodeLayer> layers) {
        super("Nesting exceeds maximum depth " + maxDepth, source, pathPrefix, layers, null);
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
