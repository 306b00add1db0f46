package com.libragraph.unwrap.core.extract;

/**
 * A leaf written to disk by an extraction.
 *
 * @param source identity of the input the leaf came from
 * @param path   logical path of the leaf
 * @param size   content length in bytes
 * @param sha256 lowercase hex SHA-256 of the content
 * @param file   location of the written file, relative to the extraction directory, '/'-separated
 */
public record LeafDescriptor(String source, String path, long size, String sha256, String file) {
}
