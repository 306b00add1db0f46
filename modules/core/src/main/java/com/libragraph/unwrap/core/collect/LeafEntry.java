package com.libragraph.unwrap.core.collect;

import com.libragraph.unwrap.util.ContentHash;

/**
 * One fully unwrapped payload, ready to become an output row.
 *
 * @param source  identity of the input the leaf came from
 * @param path    logical path: the source identity plus one segment per container layer
 * @param size    content length in bytes
 * @param content leaf bytes
 * @param hash    SHA-256 of the content
 */
public record LeafEntry(String source, String path, long size, byte[] content, ContentHash hash) {

    public static LeafEntry of(String source, String path, byte[] content) {
        return new LeafEntry(source, path, content.length, content, ContentHash.of(content));
    }
}
