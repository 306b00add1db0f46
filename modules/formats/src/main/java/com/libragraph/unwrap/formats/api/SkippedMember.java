package com.libragraph.unwrap.formats.api;

/**
 * A container entry that is not a regular file (directory, link, device, fifo).
 *
 * @param name  entry name as stored in the container
 * @param type  short description of the entry type
 */
public record SkippedMember(String name, String type) {
}
