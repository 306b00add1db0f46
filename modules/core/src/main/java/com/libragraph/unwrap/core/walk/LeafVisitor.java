package com.libragraph.unwrap.core.walk;

import com.libragraph.unwrap.formats.api.SkippedMember;
import com.libragraph.unwrap.util.buffer.BinaryData;

import java.util.List;

/**
 * Receives the results of walking one source, in depth-first member-declaration order.
 */
public interface LeafVisitor {

    /**
     * Called once per leaf. {@code data} is closed as soon as this method returns.
     *
     * @param path   logical path of the leaf
     * @param data   fully decoded leaf bytes
     * @param layers decode steps applied on the way, outermost first
     */
    void visitLeaf(String path, BinaryData data, List<DecodeLayer> layers);

    /**
     * Called for a container entry that is not a regular file.
     */
    default void visitSkipped(String path, SkippedMember member) {
    }
}
