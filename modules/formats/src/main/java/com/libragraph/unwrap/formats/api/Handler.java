package com.libragraph.unwrap.formats.api;

import java.util.List;

/**
 * Iterates the regular-file members of one container, in declaration order.
 * Each member is materialized when it is returned; earlier members stay valid.
 */
public interface Handler extends AutoCloseable {

    /**
     * Returns the next regular-file member, or null when the container is exhausted.
     *
     * @throws FormatException if the container is malformed
     */
    ArchiveMember nextMember();

    /**
     * Entries passed over so far because they are not regular files.
     */
    List<SkippedMember> skipped();

    @Override
    void close();
}
