package com.libragraph.unwrap.core.progress;

/**
 * Outcome reported for one processed leaf, or for a dropped input.
 */
public enum ProgressEvent {
    /** Leaf appended to the output table. */
    WRITTEN,
    /** Leaf materialized below the extraction directory. */
    EXTRACTED,
    /** Leaf dropped by the size or content filter. */
    SKIPPED,
    /** Leaf dropped because its content was already emitted. */
    DUPLICATE,
    /** Whole input dropped under the skip policy; the path is the source identity. */
    INPUT_FAILED
}
