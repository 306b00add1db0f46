package com.libragraph.unwrap.formats.api;

import com.libragraph.unwrap.util.buffer.BinaryData;

/**
 * A regular-file member materialized from a container.
 *
 * @param name member name as stored in the container
 * @param data member bytes, fully inflated
 */
public record ArchiveMember(String name, BinaryData data) {

    public long size() {
        return data.size();
    }
}
