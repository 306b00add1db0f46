package com.libragraph.unwrap.formats.tika;

/**
 * Coarse content classification used by include filters.
 */
public enum ContentClass {
    TEXT,
    BINARY
}
